package com.example.cruscotto.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Migrants landed on one day of the reference month, read from the daily chart.
 */
public record LandingRecord(
        int day,
        int landedMigrants,
        LocalDate referenceDate,
        String sourceFilename
) implements DatasetRecord {

    @Override
    public DatasetType dataset() {
        return DatasetType.LANDINGS;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("day", day);
        row.put("landed_migrants", landedMigrants);
        row.put(DatasetType.REFERENCE_DATE, referenceDate.toString());
        row.put(DatasetType.SOURCE_FILENAME, sourceFilename);
        return row;
    }
}
