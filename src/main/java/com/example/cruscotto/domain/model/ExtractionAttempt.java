package com.example.cruscotto.domain.model;

import java.util.List;

/**
 * Result of running one extraction strategy on one document. Never persisted.
 *
 * @param pageIndex zero-based index of the page the rows were read from
 * @param format    detected format tag
 * @param strategy  name of the strategy that produced the rows
 * @param rows      extracted rows (possibly empty)
 * @param verdict   validation outcome for {@code rows}
 */
public record ExtractionAttempt<R extends DatasetRecord>(
        int pageIndex,
        String format,
        String strategy,
        List<R> rows,
        ValidationVerdict verdict
) {

    public boolean accepted() {
        return verdict.accepted();
    }
}
