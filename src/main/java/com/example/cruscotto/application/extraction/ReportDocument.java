package com.example.cruscotto.application.extraction;

import java.io.Closeable;
import java.util.List;

/**
 * Read-only view over an opened report. Page indices are zero-based.
 */
public interface ReportDocument extends Closeable {

    int pageCount();

    /**
     * @return text of the page in reading order, lines separated by {@code \n}
     */
    String pageText(int pageIndex);

    /**
     * Table-like rows rebuilt from glyph positions: one entry per visual line, one string per cell.
     */
    List<List<String>> pageRows(int pageIndex);

    default ReportPage page(int pageIndex) {
        return new ReportPage(pageIndex, pageText(pageIndex), pageRows(pageIndex));
    }
}
