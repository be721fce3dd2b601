package com.example.cruscotto.application.extraction;

import com.example.cruscotto.domain.model.DatasetRecord;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.ValidationVerdict;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalInt;

/**
 * Dataset-specific knowledge used by {@link ExtractionEngine}: where the data lives in a report,
 * which layout it has, how to read it and when to trust the result.
 *
 * @param <R> record type produced for the dataset
 */
public interface DatasetExtractor<R extends DatasetRecord> {

    DatasetType dataset();

    /**
     * @return zero-based index of the page holding the dataset, empty when the report has none
     */
    OptionalInt locatePage(ReportDocument document);

    /**
     * @param page          located page
     * @param referenceDate date parsed from the filename
     * @return format tag passed to the strategies through {@link ExtractionContext#format()}
     */
    String detectFormat(ReportPage page, LocalDate referenceDate);

    /**
     * @return strategies in the order they are tried
     */
    List<ExtractionStrategy<R>> strategies();

    ValidationVerdict validate(List<R> rows, ExtractionContext context);
}
