package com.example.cruscotto.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Use cases throw subclasses of this type when a request cannot be served as asked, without
 * coupling to the transport or storage infrastructure.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
