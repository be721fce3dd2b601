package com.example.cruscotto.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Logical datasets extracted from the monthly reports.
 * Each dataset owns its table name, column layout and the first reference date it admits.
 */
public enum DatasetType {
    NATIONALITY(
            "nationality",
            LocalDate.of(2017, 1, 1),
            List.of(
                    ColumnSpec.string("nationality"),
                    ColumnSpec.integer("landed_migrants"),
                    ColumnSpec.string("reference_date"),
                    ColumnSpec.string("source_filename")
            )
    ),
    ACCOMMODATION(
            "accommodation",
            LocalDate.of(2017, 1, 1),
            List.of(
                    ColumnSpec.string("region"),
                    ColumnSpec.integer("hotspot_migrants"),
                    ColumnSpec.integer("reception_centre_migrants"),
                    ColumnSpec.integer("siproimi_sai_migrants"),
                    ColumnSpec.integer("total_accommodation"),
                    ColumnSpec.string("reference_date"),
                    ColumnSpec.string("source_filename"),
                    ColumnSpec.string("format")
            )
    ),
    // the daily chart only exists from September 2019 onwards
    LANDINGS(
            "landings",
            LocalDate.of(2019, 9, 1),
            List.of(
                    ColumnSpec.integer("day"),
                    ColumnSpec.integer("landed_migrants"),
                    ColumnSpec.string("reference_date"),
                    ColumnSpec.string("source_filename")
            )
    );

    public static final String REFERENCE_DATE = "reference_date";
    public static final String SOURCE_FILENAME = "source_filename";

    private final String tableName;
    private final LocalDate startBoundary;
    private final List<ColumnSpec> columns;

    DatasetType(String tableName, LocalDate startBoundary, List<ColumnSpec> columns) {
        this.tableName = tableName;
        this.startBoundary = startBoundary;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * @return first reference date admitted into the canonical dataset (inclusive)
     */
    public LocalDate startBoundary() {
        return startBoundary;
    }

    public List<ColumnSpec> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    /**
     * Resolves a dataset from its table name.
     *
     * @param tableName table name as exposed by the columnar store
     * @return matching dataset or empty when the name is unknown
     */
    public static Optional<DatasetType> fromTableName(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        String normalized = tableName.trim().toLowerCase(Locale.ROOT);
        for (DatasetType type : values()) {
            if (type.tableName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
