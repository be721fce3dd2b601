package com.example.cruscotto.application.extraction;

import com.example.cruscotto.application.service.ReferenceDateExtractor;
import com.example.cruscotto.domain.exception.ReportNotFoundException;
import com.example.cruscotto.domain.model.DatasetRecord;
import com.example.cruscotto.domain.model.ExtractionAttempt;
import com.example.cruscotto.domain.model.ExtractionBatch;
import com.example.cruscotto.domain.model.ValidationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

/**
 * Runs a {@link DatasetExtractor} over reports.
 * <p>
 * For each document the engine parses the reference date from the filename, lets the extractor
 * locate the page and pick the format, then tries the strategies in order and keeps the first
 * attempt that passes validation. Failures of one document are logged and never stop a batch.
 */
@Service
public class ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final ReportDocumentLoader loader;
    private final ReferenceDateExtractor dateExtractor;

    public ExtractionEngine(ReportDocumentLoader loader, ReferenceDateExtractor dateExtractor) {
        this.loader = loader;
        this.dateExtractor = dateExtractor;
    }

    /**
     * Extracts one dataset from one report.
     *
     * @param extractor dataset extractor
     * @param pdfPath   existing report file
     * @return accepted rows, empty when the report yields nothing trustworthy
     * @throws ReportNotFoundException when {@code pdfPath} does not exist
     */
    public <R extends DatasetRecord> Optional<List<R>> extractOne(DatasetExtractor<R> extractor, Path pdfPath) {
        if (pdfPath == null || !Files.isRegularFile(pdfPath)) {
            throw new ReportNotFoundException(String.valueOf(pdfPath));
        }
        String filename = pdfPath.getFileName().toString();
        Optional<LocalDate> referenceDate = dateExtractor.extract(filename);
        if (referenceDate.isEmpty()) {
            log.warn("[{}] reference date not recognized in {}", extractor.dataset().tableName(), filename);
            return Optional.empty();
        }
        try (ReportDocument document = loader.open(pdfPath)) {
            return extract(extractor, document, filename, referenceDate.get())
                    .map(ExtractionAttempt::rows);
        } catch (IOException | RuntimeException ex) {
            log.warn("[{}] extraction failed for {}: {}", extractor.dataset().tableName(), filename, ex.getMessage());
            log.debug("Extraction failure detail", ex);
            return Optional.empty();
        }
    }

    /**
     * Extracts one dataset from every {@code *.pdf} in {@code folder}, in filename order.
     */
    public <R extends DatasetRecord> ExtractionBatch<R> processAll(DatasetExtractor<R> extractor, Path folder) {
        return processAll(extractor, folder, path -> true);
    }

    /**
     * Same as {@link #processAll(DatasetExtractor, Path)} restricted to files accepted by {@code filter}.
     */
    public <R extends DatasetRecord> ExtractionBatch<R> processAll(DatasetExtractor<R> extractor,
                                                                   Path folder,
                                                                   Predicate<Path> filter) {
        List<Path> files = listPdfs(folder).stream().filter(filter).toList();
        String table = extractor.dataset().tableName();
        log.info("[{}] processing {} reports from {}", table, files.size(), folder);

        List<R> records = new ArrayList<>();
        List<String> processed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            String filename = file.getFileName().toString();
            Optional<List<R>> rows = extractOne(extractor, file);
            if (rows.isPresent() && !rows.get().isEmpty()) {
                records.addAll(rows.get());
                log.info("[{}] {}/{} {}: {} rows", table, i + 1, files.size(), filename, rows.get().size());
            } else {
                failed.add(filename);
                log.info("[{}] {}/{} {}: no data", table, i + 1, files.size(), filename);
            }
            processed.add(filename);
        }
        ExtractionBatch<R> batch = new ExtractionBatch<>(extractor.dataset(), records, processed, failed);
        log.info("[{}] processed {} reports, {} succeeded, {} failed, {} rows",
                table, processed.size(), batch.succeeded(), failed.size(), records.size());
        return batch;
    }

    private <R extends DatasetRecord> Optional<ExtractionAttempt<R>> extract(DatasetExtractor<R> extractor,
                                                                             ReportDocument document,
                                                                             String filename,
                                                                             LocalDate referenceDate) {
        String table = extractor.dataset().tableName();
        OptionalInt pageIndex = extractor.locatePage(document);
        if (pageIndex.isEmpty()) {
            log.info("[{}] no matching page in {}", table, filename);
            return Optional.empty();
        }
        ReportPage page = document.page(pageIndex.getAsInt());
        String format = extractor.detectFormat(page, referenceDate);
        ExtractionContext context = new ExtractionContext(filename, referenceDate, format);
        log.debug("[{}] {} page {} format {}", table, filename, page.index() + 1, format);

        for (ExtractionStrategy<R> strategy : extractor.strategies()) {
            List<R> rows = strategy.extract(page, context);
            ValidationVerdict verdict = extractor.validate(rows, context);
            ExtractionAttempt<R> attempt = new ExtractionAttempt<>(page.index(), format, strategy.name(), rows, verdict);
            if (attempt.accepted()) {
                return Optional.of(attempt);
            }
            log.debug("[{}] {} strategy {} rejected: {}", table, filename, strategy.name(), verdict.reason());
        }
        log.warn("[{}] every strategy rejected for {}", table, filename);
        return Optional.empty();
    }

    private List<Path> listPdfs(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            log.warn("Report folder {} does not exist", folder);
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, "*.pdf")) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException ex) {
            log.warn("Unable to list reports in {}: {}", folder, ex.getMessage());
            return List.of();
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
