package com.example.cruscotto.domain.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * Common shape of a normalized row extracted from one report.
 * The reference date always comes from the report filename, never from the document body.
 */
public interface DatasetRecord {

    DatasetType dataset();

    LocalDate referenceDate();

    String sourceFilename();

    /**
     * Flattens the record into a row keyed by the dataset column names, in column order.
     *
     * @return mutable row map
     */
    Map<String, Object> toRow();
}
