package com.example.cruscotto.domain.exception;

/**
 * Base type for domain-level failures such as references to reports or tables that do not exist.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation of the rejected input
	 */
    protected DomainException(String message) {
        super(message);
    }
}
