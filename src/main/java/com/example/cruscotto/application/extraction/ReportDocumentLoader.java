package com.example.cruscotto.application.extraction;

import java.nio.file.Path;

/**
 * Opens report files. Implementations throw
 * {@link com.example.cruscotto.infrastructure.exception.PdfProcessingException} when a file cannot be read.
 */
public interface ReportDocumentLoader {

    ReportDocument open(Path pdf);
}
