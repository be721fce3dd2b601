package com.example.cruscotto.domain.model;

/**
 * Row count and sum of the main measure for one (year, month) of a table.
 */
public record TemporalCoverage(int year, int month, long rowCount, long total) {
}
