package com.example.cruscotto.application.service;

import com.example.cruscotto.application.exception.CsvExportValidationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Application-layer service that turns query rows into CSV content.
 */
@Service
public class CsvExportService {

	/**
	 * Runs validation and returns a CSV string containing the given rows.
	 *
	 * @param columns header, in output order
	 * @param rows    rows keyed by column name
	 * @return CSV document with a header line
	 * @throws CsvExportValidationException when there are no columns or no rows
	 */
    public String export(List<String> columns, List<Map<String, Object>> rows) {
        if (columns == null || columns.isEmpty()) {
            throw new CsvExportValidationException("No columns available for export.");
        }
        if (rows == null || rows.isEmpty()) {
            throw new CsvExportValidationException("No rows available for export.");
        }
        return buildCsv(columns, rows);
    }

	/**
	 * Writes the header line followed by one line per row, columns in header order.
	 */
    private String buildCsv(List<String> columns, List<Map<String, Object>> rows) {
        StringBuilder builder = new StringBuilder();
        appendLine(builder, columns);
        for (Map<String, Object> row : rows) {
            List<String> values = columns.stream()
                    .map(column -> row.get(column) == null ? null : row.get(column).toString())
                    .toList();
            appendLine(builder, values);
        }
        return builder.toString();
    }

    private void appendLine(StringBuilder builder, List<String> values) {
        builder.append(values.stream().map(this::escape).collect(Collectors.joining(","))).append('\n');
    }

	/**
	 * Quotes values containing a separator, a quote or a line break; nulls become empty cells.
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean quote = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        return quote ? "\"" + value.replace("\"", "\"\"") + "\"" : value;
    }
}
