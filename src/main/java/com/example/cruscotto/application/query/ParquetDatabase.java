package com.example.cruscotto.application.query;

import com.example.cruscotto.application.exception.InvalidQueryException;
import com.example.cruscotto.application.service.CsvExportService;
import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.domain.exception.TableNotFoundException;
import com.example.cruscotto.domain.model.ColumnSpec;
import com.example.cruscotto.domain.model.DatabaseStats;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.TableMetadata;
import com.example.cruscotto.domain.model.TemporalCoverage;
import com.example.cruscotto.infrastructure.exception.ColumnarStoreException;
import com.example.cruscotto.infrastructure.parquet.ParquetTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Query layer over the Parquet tables in the output directory.
 * <p>
 * Table metadata is read from file footers when the directory is scanned; rows are loaded on first
 * use and cached. Only {@link #refresh()}, a forced reload or a write through
 * {@link #replaceTable(DatasetType, List)} invalidates the cache.
 */
@Service
public class ParquetDatabase {

    private static final Logger log = LoggerFactory.getLogger(ParquetDatabase.class);

    private static final List<String> MAIN_MEASURES = List.of(
            "landed_migrants", "total_accommodation", "hotspot_migrants",
            "reception_centre_migrants", "siproimi_sai_migrants");

    private final Path directory;
    private final ParquetTableStore store;
    private final CsvExportService csvExportService;
    private final Map<String, TableMetadata> metadata = new TreeMap<>();
    private final Map<String, List<Map<String, Object>>> cache = new HashMap<>();
    private boolean scanned = false;

    @Autowired
    public ParquetDatabase(CruscottoProperties properties, ParquetTableStore store, CsvExportService csvExportService) {
        this(Paths.get(properties.getStorage().getOutputDirectory()), store, csvExportService);
    }

    public ParquetDatabase(Path directory, ParquetTableStore store, CsvExportService csvExportService) {
        this.directory = directory;
        this.store = store;
        this.csvExportService = csvExportService;
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return table names, sorted
     */
    public synchronized List<String> listTables() {
        ensureScanned();
        return List.copyOf(metadata.keySet());
    }

    public synchronized boolean hasTable(String name) {
        ensureScanned();
        return metadata.containsKey(name);
    }

    public List<Map<String, Object>> getTable(String name) {
        return getTable(name, false);
    }

    /**
     * Returns a copy of every row of a table.
     *
     * @param forceReload re-read the file even when rows are cached
     * @throws TableNotFoundException when the table does not exist
     */
    public synchronized List<Map<String, Object>> getTable(String name, boolean forceReload) {
        return copy(rows(name, forceReload));
    }

    /**
     * Filters a table.
     *
     * @param table      table name
     * @param dateColumn column holding ISO dates; {@code null} means {@code reference_date}
     * @param start      inclusive lower bound, optional
     * @param end        inclusive upper bound, optional
     * @param filters    column to value; a {@link Collection} value means membership. Values are
     *                   compared by their string form. Columns the table does not have are ignored.
     * @param columns    projection; unknown names are dropped, {@code null} or empty keeps every column
     * @return fresh list of fresh rows
     * @throws TableNotFoundException when the table does not exist
     * @throws InvalidQueryException  when the date column is unknown or {@code start} is after {@code end}
     */
    public synchronized List<Map<String, Object>> query(String table,
                                                        String dateColumn,
                                                        LocalDate start,
                                                        LocalDate end,
                                                        Map<String, ?> filters,
                                                        List<String> columns) {
        List<Map<String, Object>> source = rows(table, false);
        List<String> tableColumns = metadata.get(table).columns();
        String dateCol = dateColumn == null || dateColumn.isBlank() ? DatasetType.REFERENCE_DATE : dateColumn;
        if ((start != null || end != null) && !tableColumns.contains(dateCol)) {
            throw new InvalidQueryException("Unknown date column '" + dateCol + "' for table " + table);
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidQueryException("Start date " + start + " is after end date " + end);
        }
        List<String> projection = columns == null || columns.isEmpty()
                ? tableColumns
                : columns.stream().filter(tableColumns::contains).toList();

        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : source) {
            if ((start != null || end != null) && !inRange(row.get(dateCol), start, end)) {
                continue;
            }
            if (filters != null && !matches(row, filters, tableColumns)) {
                continue;
            }
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : projection) {
                projected.put(column, row.get(column));
            }
            result.add(projected);
        }
        return result;
    }

    /**
     * Row count and sum of the main measure per (year, month) of {@code reference_date}.
     * The main measure is the first of {@code landed_migrants}, {@code total_accommodation} and the
     * accommodation breakdown present in the table, else the first integer column.
     */
    public synchronized List<TemporalCoverage> getTemporalCoverage(String table) {
        List<Map<String, Object>> source = rows(table, false);
        List<String> tableColumns = metadata.get(table).columns();
        if (!tableColumns.contains(DatasetType.REFERENCE_DATE)) {
            return List.of();
        }
        Optional<String> measure = mainMeasure(table, tableColumns, source);
        Map<YearMonth, long[]> buckets = new TreeMap<>();
        for (Map<String, Object> row : source) {
            Optional<LocalDate> date = parseDate(row.get(DatasetType.REFERENCE_DATE));
            if (date.isEmpty()) {
                continue;
            }
            long[] bucket = buckets.computeIfAbsent(YearMonth.from(date.get()), key -> new long[2]);
            bucket[0]++;
            if (measure.isPresent() && row.get(measure.get()) instanceof Number number) {
                bucket[1] += number.longValue();
            }
        }
        List<TemporalCoverage> coverage = new ArrayList<>();
        buckets.forEach((period, bucket) ->
                coverage.add(new TemporalCoverage(period.getYear(), period.getMonthValue(), bucket[0], bucket[1])));
        return coverage;
    }

    /**
     * @throws TableNotFoundException when the table does not exist
     */
    public synchronized TableMetadata getTableInfo(String name) {
        ensureScanned();
        TableMetadata info = metadata.get(name);
        if (info == null) {
            throw new TableNotFoundException(name);
        }
        return info;
    }

    public synchronized DatabaseStats getDatabaseStats() {
        ensureScanned();
        long size = 0;
        long rowCount = 0;
        for (TableMetadata info : metadata.values()) {
            size += info.sizeBytes();
            rowCount += info.rowCount();
        }
        return new DatabaseStats(metadata.size(), size, rowCount, Map.copyOf(metadata));
    }

    /**
     * @return CSV of every row of a table
     */
    public synchronized String exportCsv(String table) {
        List<Map<String, Object>> source = rows(table, false);
        return csvExportService.export(metadata.get(table).columns(), source);
    }

    /**
     * Writes a table as CSV to {@code target}, creating parent directories.
     */
    public void exportToCsv(String table, Path target) {
        String csv = exportCsv(table);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, csv, StandardCharsets.UTF_8);
            log.info("Exported table {} to {}", table, target);
        } catch (IOException ex) {
            throw new ColumnarStoreException("Failed to export table " + table + " to " + target, ex);
        }
    }

    /**
     * Persists a dataset table and invalidates its cached rows and metadata.
     */
    public synchronized void replaceTable(DatasetType dataset, List<Map<String, Object>> rows) {
        Path file = store.write(directory, dataset, rows);
        cache.remove(dataset.tableName());
        if (scanned) {
            metadata.put(dataset.tableName(), store.readMetadata(file));
        }
    }

    /**
     * Drops every cached row and rescans the directory.
     */
    public synchronized void refresh() {
        cache.clear();
        metadata.clear();
        scanned = false;
        ensureScanned();
        log.info("Database refreshed: {} tables in {}", metadata.size(), directory);
    }

    private List<Map<String, Object>> rows(String name, boolean forceReload) {
        ensureScanned();
        TableMetadata info = metadata.get(name);
        if (info == null) {
            throw new TableNotFoundException(name);
        }
        if (forceReload || !cache.containsKey(name)) {
            List<Map<String, Object>> loaded = store.read(info.filePath());
            cache.put(name, loaded);
            log.debug("Loaded table {} ({} rows)", name, loaded.size());
        }
        return cache.get(name);
    }

    private void ensureScanned() {
        if (scanned) {
            return;
        }
        scanned = true;
        if (!Files.isDirectory(directory)) {
            log.warn("Data directory {} not found", directory);
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + ParquetTableStore.EXTENSION)) {
            for (Path file : stream) {
                try {
                    TableMetadata info = store.readMetadata(file);
                    metadata.put(info.name(), info);
                } catch (ColumnarStoreException ex) {
                    log.error("Skipping unreadable table {}: {}", file.getFileName(), ex.getMessage());
                }
            }
        } catch (IOException ex) {
            throw new ColumnarStoreException("Failed to scan " + directory, ex);
        }
    }

    private static Optional<String> mainMeasure(String table, List<String> columns, List<Map<String, Object>> rows) {
        for (String candidate : MAIN_MEASURES) {
            if (columns.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        Optional<DatasetType> dataset = DatasetType.fromTableName(table);
        if (dataset.isPresent()) {
            return dataset.get().columns().stream()
                    .filter(ColumnSpec::numeric)
                    .map(ColumnSpec::name)
                    .findFirst();
        }
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return columns.stream().filter(column -> rows.get(0).get(column) instanceof Number).findFirst();
    }

    private static boolean inRange(Object value, LocalDate start, LocalDate end) {
        Optional<LocalDate> date = parseDate(value);
        if (date.isEmpty()) {
            return false;
        }
        return (start == null || !date.get().isBefore(start)) && (end == null || !date.get().isAfter(end));
    }

    private static boolean matches(Map<String, Object> row, Map<String, ?> filters, List<String> columns) {
        for (Map.Entry<String, ?> filter : filters.entrySet()) {
            if (!columns.contains(filter.getKey())) {
                continue;
            }
            String actual = String.valueOf(row.get(filter.getKey()));
            Object expected = filter.getValue();
            if (expected instanceof Collection<?> values) {
                if (values.stream().map(String::valueOf).noneMatch(actual::equals)) {
                    return false;
                }
            } else if (!actual.equals(String.valueOf(expected))) {
                return false;
            }
        }
        return true;
    }

    private static Optional<LocalDate> parseDate(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.toString()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return copy;
    }
}
