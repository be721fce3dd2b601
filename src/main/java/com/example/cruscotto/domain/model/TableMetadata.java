package com.example.cruscotto.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Lightweight description of a columnar table, read from the file footer without loading rows.
 * {@code minReferenceDate} and {@code maxReferenceDate} are {@code null} for empty tables.
 */
public record TableMetadata(
        String name,
        Path filePath,
        List<String> columns,
        long sizeBytes,
        Instant lastModified,
        long rowCount,
        String minReferenceDate,
        String maxReferenceDate
) {
}
