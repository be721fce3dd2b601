package com.example.cruscotto.domain.model;

/**
 * Aggregate outcome of a download over a range of months.
 */
public record DownloadSummary(int total, int success, int failed) {

    public double successRate() {
        return total == 0 ? 0d : (success * 100d) / total;
    }
}
