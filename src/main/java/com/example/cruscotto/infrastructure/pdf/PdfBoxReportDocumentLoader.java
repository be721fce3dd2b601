package com.example.cruscotto.infrastructure.pdf;

import com.example.cruscotto.application.extraction.ReportDocument;
import com.example.cruscotto.application.extraction.ReportDocumentLoader;
import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens reports with PDFBox.
 */
@Component
public class PdfBoxReportDocumentLoader implements ReportDocumentLoader {

    private final float cellGap;

    @Autowired
    public PdfBoxReportDocumentLoader(CruscottoProperties properties) {
        this(properties.getExtraction().getCellGap());
    }

    PdfBoxReportDocumentLoader(float cellGap) {
        this.cellGap = cellGap;
    }

    @Override
    public ReportDocument open(Path pdf) {
        try {
            return new PdfBoxReportDocument(Loader.loadPDF(pdf.toFile()), pdf.getFileName().toString(), cellGap);
        } catch (IOException ex) {
            throw new PdfProcessingException(String.valueOf(pdf.getFileName()), "Failed to open PDF", ex);
        }
    }
}
