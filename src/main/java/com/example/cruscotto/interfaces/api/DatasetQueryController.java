package com.example.cruscotto.interfaces.api;

import com.example.cruscotto.application.exception.InvalidQueryException;
import com.example.cruscotto.application.query.ParquetDatabase;
import com.example.cruscotto.domain.model.DatabaseStats;
import com.example.cruscotto.domain.model.TableMetadata;
import com.example.cruscotto.domain.model.TemporalCoverage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only REST endpoints over the canonical tables.
 */
@RestController
@RequestMapping("/api")
public class DatasetQueryController {

    private static final Set<String> RESERVED_PARAMS = Set.of("start", "end", "dateColumn", "columns");

    private final ParquetDatabase database;

    public DatasetQueryController(ParquetDatabase database) {
        this.database = database;
    }

    @GetMapping("/tables")
    public List<String> listTables() {
        return database.listTables();
    }

    @GetMapping("/tables/{name}")
    public TableMetadata tableInfo(@PathVariable String name) {
        return database.getTableInfo(name);
    }

    /**
     * Rows of a table filtered by an inclusive date range and by column values.
     * Any request parameter other than {@code start}, {@code end}, {@code dateColumn} and
     * {@code columns} is a column filter; repeating it turns the filter into a membership test.
     *
     * @param name   table name
     * @param params every request parameter
     * @return matching rows
     */
    @GetMapping("/tables/{name}/rows")
    public List<Map<String, Object>> rows(@PathVariable String name,
                                          @RequestParam MultiValueMap<String, String> params) {
        LocalDate start = parseDate("start", params.getFirst("start"));
        LocalDate end = parseDate("end", params.getFirst("end"));
        List<String> columns = params.containsKey("columns")
                ? params.get("columns").stream()
                    .flatMap(value -> Arrays.stream(value.split(",")))
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .toList()
                : null;

        Map<String, Object> filters = new LinkedHashMap<>();
        params.forEach((key, values) -> {
            if (RESERVED_PARAMS.contains(key) || values.isEmpty()) {
                return;
            }
            filters.put(key, values.size() == 1 ? values.get(0) : List.copyOf(values));
        });
        return database.query(name, params.getFirst("dateColumn"), start, end, filters, columns);
    }

    @GetMapping("/tables/{name}/coverage")
    public List<TemporalCoverage> coverage(@PathVariable String name) {
        return database.getTemporalCoverage(name);
    }

    /**
     * Streams a whole table as a CSV download.
     */
    @GetMapping("/tables/{name}/export")
    public ResponseEntity<byte[]> export(@PathVariable String name) {
        String csv = database.exportCsv(name);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + name + ".csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/stats")
    public DatabaseStats stats() {
        return database.getDatabaseStats();
    }

    private static LocalDate parseDate(String param, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidQueryException("Parameter '" + param + "' must be an ISO date (yyyy-MM-dd): " + value, ex);
        }
    }
}
