package com.example.cruscotto.infrastructure.exception;

/**
 * Signals that PDFBox could not open or read a report. The report file name is kept so the
 * batch can log which month was lost.
 */
public class PdfProcessingException extends InfrastructureException {

    private final String reportName;

	/**
	 * @param reportName file name of the report being read
	 * @param action     what was being attempted, e.g. {@code "Failed to open PDF"}
	 * @param cause      low-level PDFBox exception
	 */
    public PdfProcessingException(String reportName, String action, Throwable cause) {
        super(action + " " + reportName, cause);
        this.reportName = reportName;
    }

    public String getReportName() {
        return reportName;
    }
}
