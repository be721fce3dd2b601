package com.example.cruscotto.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Migrants landed per declared nationality, cumulative to the reference date.
 */
public record NationalityRecord(
        String nationality,
        int landedMigrants,
        LocalDate referenceDate,
        String sourceFilename
) implements DatasetRecord {

    @Override
    public DatasetType dataset() {
        return DatasetType.NATIONALITY;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("nationality", nationality);
        row.put("landed_migrants", landedMigrants);
        row.put(DatasetType.REFERENCE_DATE, referenceDate.toString());
        row.put(DatasetType.SOURCE_FILENAME, sourceFilename);
        return row;
    }
}
