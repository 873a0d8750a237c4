package com.localization.toolkit.storage.exception;

/**
 * Base class for errors raised while reading or writing Fluent stores.
 */
public class FluentException extends RuntimeException {

	private static final long serialVersionUID = 1L;

    public FluentException(String message) {
        super(message);
    }

    public FluentException(String message, Throwable cause) {
        super(message, cause);
    }
}
