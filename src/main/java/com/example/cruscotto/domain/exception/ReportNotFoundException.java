package com.example.cruscotto.domain.exception;

/**
 * Raised when a report path handed to the extraction layer does not exist on disk.
 */
public class ReportNotFoundException extends DomainException {

    private final String path;

	/**
	 * @param path path that could not be resolved
	 */
    public ReportNotFoundException(String path) {
        super("Report not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
