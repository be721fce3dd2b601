package com.example.cruscotto.domain.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Migrants in the reception system per region at the reference date.
 * Pre-cutover reports only publish the total, so the three breakdown measures are zero for them.
 */
public record AccommodationRecord(
        String region,
        int hotspotMigrants,
        int receptionCentreMigrants,
        int siproimiSaiMigrants,
        int totalAccommodation,
        LocalDate referenceDate,
        String sourceFilename,
        AccommodationFormat format
) implements DatasetRecord {

    @Override
    public DatasetType dataset() {
        return DatasetType.ACCOMMODATION;
    }

    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region", region);
        row.put("hotspot_migrants", hotspotMigrants);
        row.put("reception_centre_migrants", receptionCentreMigrants);
        row.put("siproimi_sai_migrants", siproimiSaiMigrants);
        row.put("total_accommodation", totalAccommodation);
        row.put(DatasetType.REFERENCE_DATE, referenceDate.toString());
        row.put(DatasetType.SOURCE_FILENAME, sourceFilename);
        row.put("format", format.tag());
        return row;
    }
}
