package com.example.cruscotto.domain.model;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Candidate locations for the report of one period: the override URL when the period is listed
 * in the override table, then the generated filename variants inside the expected folder.
 */
public record ResolvedSource(
        YearMonth period,
        Optional<String> overrideUrl,
        String folder,
        List<String> variantFilenames
) {
}
