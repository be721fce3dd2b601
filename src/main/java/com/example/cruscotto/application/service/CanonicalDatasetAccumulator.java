package com.example.cruscotto.application.service;

import com.example.cruscotto.application.query.ParquetDatabase;
import com.example.cruscotto.domain.model.DatasetRecord;
import com.example.cruscotto.domain.model.DatasetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects extracted records per dataset and turns them into the canonical tables.
 * <p>
 * The working set holds at most one record group per (reference date, source filename): a report
 * extracted twice replaces its earlier rows. Canonical tables are sorted by reference date and never
 * contain rows dated before the dataset's start boundary.
 */
@Service
public class CanonicalDatasetAccumulator {

    private static final Logger log = LoggerFactory.getLogger(CanonicalDatasetAccumulator.class);
    private static final Comparator<Map<String, Object>> BY_REFERENCE_DATE =
            Comparator.comparing(row -> String.valueOf(row.get(DatasetType.REFERENCE_DATE)));

    private final ParquetDatabase database;
    private final Map<DatasetType, Map<String, List<Map<String, Object>>>> workingSet = new EnumMap<>(DatasetType.class);

    public CanonicalDatasetAccumulator(ParquetDatabase database) {
        this.database = database;
    }

    /**
     * Adds records to the working set of {@code dataset}.
     */
    public synchronized void accumulate(DatasetType dataset, List<? extends DatasetRecord> records) {
        Map<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (DatasetRecord record : records) {
            if (record.dataset() != dataset) {
                throw new IllegalArgumentException("Record of " + record.dataset() + " offered to " + dataset);
            }
            groups.computeIfAbsent(groupKey(record), key -> new ArrayList<>()).add(record.toRow());
        }
        Map<String, List<Map<String, Object>>> current = workingSet.computeIfAbsent(dataset, key -> new LinkedHashMap<>());
        groups.forEach((key, rows) -> {
            if (current.put(key, rows) != null) {
                log.debug("[{}] replaced rows of {}", dataset.tableName(), key);
            }
        });
    }

    public synchronized int workingSetSize(DatasetType dataset) {
        return workingSet.getOrDefault(dataset, Map.of()).values().stream().mapToInt(List::size).sum();
    }

    public synchronized void clear(DatasetType dataset) {
        workingSet.remove(dataset);
    }

    /**
     * Persists the working set of {@code dataset} as its canonical table, replacing the stored one.
     *
     * @return the canonical rows written
     */
    public synchronized List<Map<String, Object>> saveCanonical(DatasetType dataset) {
        List<Map<String, Object>> rows = new ArrayList<>();
        workingSet.getOrDefault(dataset, Map.of()).values().forEach(rows::addAll);
        List<Map<String, Object>> canonical = canonicalize(dataset, rows);
        database.replaceTable(dataset, canonical);
        log.info("[{}] saved {} canonical rows", dataset.tableName(), canonical.size());
        return canonical;
    }

    /**
     * Merges freshly extracted records into the stored table of {@code dataset} and persists it.
     *
     * @return the canonical rows written
     */
    public synchronized List<Map<String, Object>> update(DatasetType dataset, List<? extends DatasetRecord> records) {
        List<Map<String, Object>> existing = database.hasTable(dataset.tableName())
                ? database.getTable(dataset.tableName(), true)
                : List.of();
        List<Map<String, Object>> incoming = records.stream().map(DatasetRecord::toRow).toList();
        List<Map<String, Object>> canonical = canonicalize(dataset, merge(existing, incoming));
        database.replaceTable(dataset, canonical);
        log.info("[{}] merged {} new rows into {} existing, {} rows stored",
                dataset.tableName(), incoming.size(), existing.size(), canonical.size());
        return canonical;
    }

    /**
     * Removes every existing row whose reference date occurs anywhere in {@code incoming}, then
     * appends {@code incoming}. Supersede works on whole dates, not on individual categories.
     */
    public static List<Map<String, Object>> merge(List<Map<String, Object>> existing, List<Map<String, Object>> incoming) {
        Set<String> supersededDates = new HashSet<>();
        for (Map<String, Object> row : incoming) {
            supersededDates.add(String.valueOf(row.get(DatasetType.REFERENCE_DATE)));
        }
        List<Map<String, Object>> merged = new ArrayList<>(existing.size() + incoming.size());
        for (Map<String, Object> row : existing) {
            if (!supersededDates.contains(String.valueOf(row.get(DatasetType.REFERENCE_DATE)))) {
                merged.add(row);
            }
        }
        merged.addAll(incoming);
        return merged;
    }

    /**
     * Stable sort by reference date, then drops rows dated before the dataset boundary.
     */
    static List<Map<String, Object>> canonicalize(DatasetType dataset, List<Map<String, Object>> rows) {
        String boundary = dataset.startBoundary().toString();
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(BY_REFERENCE_DATE);
        List<Map<String, Object>> kept = sorted.stream()
                .filter(row -> String.valueOf(row.get(DatasetType.REFERENCE_DATE)).compareTo(boundary) >= 0)
                .toList();
        if (kept.size() < sorted.size()) {
            log.info("[{}] dropped {} rows dated before {}", dataset.tableName(), sorted.size() - kept.size(), boundary);
        }
        return kept;
    }

    private static String groupKey(DatasetRecord record) {
        return record.referenceDate() + "|" + record.sourceFilename();
    }
}
