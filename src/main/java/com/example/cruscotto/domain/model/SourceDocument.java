package com.example.cruscotto.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.time.YearMonth;

/**
 * A report acquired for one period. The file at {@code localPath} is written once and never
 * re-fetched or re-verified afterwards.
 */
public record SourceDocument(
        YearMonth period,
        String url,
        Path localPath,
        Instant retrievedAt
) {

    public String localFilename() {
        return localPath.getFileName().toString();
    }
}
