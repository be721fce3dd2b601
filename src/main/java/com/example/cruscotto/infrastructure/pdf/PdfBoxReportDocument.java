package com.example.cruscotto.infrastructure.pdf;

import com.example.cruscotto.application.extraction.ReportDocument;
import com.example.cruscotto.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReportDocument} backed by a loaded PDFBox document. Page text and rows are computed on
 * first access and cached until the document is closed.
 */
class PdfBoxReportDocument implements ReportDocument {

    private final PDDocument document;
    private final String name;
    private final float cellGap;
    private final Map<Integer, String> texts = new HashMap<>();
    private final Map<Integer, List<List<String>>> rows = new HashMap<>();

    PdfBoxReportDocument(PDDocument document, String name, float cellGap) {
        this.document = document;
        this.name = name;
        this.cellGap = cellGap;
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public String pageText(int pageIndex) {
        checkIndex(pageIndex);
        return texts.computeIfAbsent(pageIndex, this::stripText);
    }

    @Override
    public List<List<String>> pageRows(int pageIndex) {
        checkIndex(pageIndex);
        return rows.computeIfAbsent(pageIndex, this::stripRows);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private String stripText(int pageIndex) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setShouldSeparateByBeads(true);
            stripper.setSuppressDuplicateOverlappingText(false);
            stripper.setLineSeparator("\n");
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            return stripper.getText(document);
        } catch (IOException ex) {
            throw new PdfProcessingException(name, "Failed to read text of page " + (pageIndex + 1) + " of", ex);
        }
    }

    private List<List<String>> stripRows(int pageIndex) {
        try {
            TableRowStripper stripper = new TableRowStripper(pageIndex + 1);
            stripper.getText(document);
            return stripper.getLines().stream()
                    .map(line -> line.cells(cellGap))
                    .filter(cells -> !cells.isEmpty())
                    .toList();
        } catch (IOException ex) {
            throw new PdfProcessingException(name, "Failed to read table rows of page " + (pageIndex + 1) + " of", ex);
        }
    }

    private void checkIndex(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= pageCount()) {
            throw new IndexOutOfBoundsException("Page " + pageIndex + " outside 0.." + (pageCount() - 1));
        }
    }
}
