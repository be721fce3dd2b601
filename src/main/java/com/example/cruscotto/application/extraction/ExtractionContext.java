package com.example.cruscotto.application.extraction;

import java.time.LocalDate;

/**
 * What an extraction strategy knows about the document it is working on.
 *
 * @param sourceFilename report filename, stored on every record
 * @param referenceDate  date parsed from the filename
 * @param format         format tag chosen by the extractor for this page
 */
public record ExtractionContext(String sourceFilename, LocalDate referenceDate, String format) {
}
