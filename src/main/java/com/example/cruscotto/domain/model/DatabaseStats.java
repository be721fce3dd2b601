package com.example.cruscotto.domain.model;

import java.util.Map;

/**
 * Summary of every table known to the columnar store.
 */
public record DatabaseStats(int totalTables, long totalSizeBytes, long totalRows, Map<String, TableMetadata> tables) {
}
