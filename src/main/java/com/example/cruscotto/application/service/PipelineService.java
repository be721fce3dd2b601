package com.example.cruscotto.application.service;

import com.example.cruscotto.application.extraction.DatasetExtractor;
import com.example.cruscotto.application.extraction.ExtractionEngine;
import com.example.cruscotto.application.query.ParquetDatabase;
import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.domain.model.DatasetRunSummary;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.DownloadSummary;
import com.example.cruscotto.domain.model.ExtractionBatch;
import com.example.cruscotto.domain.model.PipelineReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Orchestrates acquisition, extraction and persistence.
 * <p>
 * Steps run in order: download missing reports, run every extractor, persist the canonical tables,
 * refresh the query layer. A dataset that fails is reported in the {@link PipelineReport} and does
 * not stop the others.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final DocumentAcquirer acquirer;
    private final ExtractionEngine engine;
    private final List<DatasetExtractor<?>> extractors;
    private final CanonicalDatasetAccumulator accumulator;
    private final ParquetDatabase database;
    private final ReferenceDateExtractor dateExtractor;
    private final CruscottoProperties.Pipeline settings;
    private final Clock clock;

    public PipelineService(DocumentAcquirer acquirer,
                           ExtractionEngine engine,
                           List<DatasetExtractor<?>> extractors,
                           CanonicalDatasetAccumulator accumulator,
                           ParquetDatabase database,
                           ReferenceDateExtractor dateExtractor,
                           CruscottoProperties properties,
                           Clock clock) {
        this.acquirer = acquirer;
        this.engine = engine;
        this.extractors = extractors.stream()
                .sorted(Comparator.comparing(extractor -> extractor.dataset().ordinal()))
                .toList();
        this.accumulator = accumulator;
        this.database = database;
        this.dateExtractor = dateExtractor;
        this.settings = properties.getPipeline();
        this.clock = clock;
    }

    /**
     * Downloads the configured range, rebuilds every canonical table from all local reports and
     * refreshes the query layer.
     */
    public synchronized PipelineReport runFull() {
        log.info("Full pipeline run started");
        DownloadSummary download = acquirer.downloadConfiguredRange();
        Path folder = acquirer.pdfDirectory();
        Map<DatasetType, DatasetRunSummary> datasets = new EnumMap<>(DatasetType.class);
        for (DatasetExtractor<?> extractor : extractors) {
            datasets.put(extractor.dataset(), rebuild(extractor, folder));
        }
        database.refresh();
        log.info("Full pipeline run finished");
        return new PipelineReport(download, datasets);
    }

    /**
     * Fetches the report of the previous month, re-extracts the reports of the recent window and
     * merges them into the stored tables.
     */
    public synchronized PipelineReport runMonthlyUpdate() {
        YearMonth previous = YearMonth.now(clock).minusMonths(1);
        log.info("Monthly update started for {}", previous);
        boolean fetched = acquirer.process(previous.getYear(), previous.getMonthValue());
        DownloadSummary download = new DownloadSummary(1, fetched ? 1 : 0, fetched ? 0 : 1);

        LocalDate cutoff = LocalDate.now(clock).minusDays(settings.getUpdateWindowMonths() * 30L);
        Predicate<Path> recent = path -> dateExtractor.extract(path.getFileName().toString())
                .map(date -> !date.isBefore(cutoff))
                .orElse(false);
        Path folder = acquirer.pdfDirectory();
        Map<DatasetType, DatasetRunSummary> datasets = new EnumMap<>(DatasetType.class);
        for (DatasetExtractor<?> extractor : extractors) {
            datasets.put(extractor.dataset(), merge(extractor, folder, recent));
        }
        database.refresh();
        log.info("Monthly update finished");
        return new PipelineReport(download, datasets);
    }

    private DatasetRunSummary rebuild(DatasetExtractor<?> extractor, Path folder) {
        DatasetType dataset = extractor.dataset();
        try {
            ExtractionBatch<?> batch = engine.processAll(extractor, folder);
            accumulator.clear(dataset);
            accumulator.accumulate(dataset, batch.records());
            int persisted = accumulator.saveCanonical(dataset).size();
            return summarize(batch, persisted);
        } catch (RuntimeException ex) {
            log.error("[{}] rebuild failed: {}", dataset.tableName(), ex.getMessage(), ex);
            return DatasetRunSummary.failure(ex.getMessage());
        }
    }

    private DatasetRunSummary merge(DatasetExtractor<?> extractor, Path folder, Predicate<Path> filter) {
        DatasetType dataset = extractor.dataset();
        try {
            ExtractionBatch<?> batch = engine.processAll(extractor, folder, filter);
            if (batch.records().isEmpty()) {
                log.info("[{}] no new data", dataset.tableName());
                return summarize(batch, 0);
            }
            int persisted = accumulator.update(dataset, batch.records()).size();
            return summarize(batch, persisted);
        } catch (RuntimeException ex) {
            log.error("[{}] update failed: {}", dataset.tableName(), ex.getMessage(), ex);
            return DatasetRunSummary.failure(ex.getMessage());
        }
    }

    private static DatasetRunSummary summarize(ExtractionBatch<?> batch, int persisted) {
        return new DatasetRunSummary(
                batch.processedFiles().size(),
                batch.succeeded(),
                batch.failedFiles().size(),
                persisted,
                List.copyOf(batch.failedFiles()),
                null);
    }
}
