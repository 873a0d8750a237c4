package com.localization.toolkit.storage.exception;

/**
 * No store is registered for a file name.
 */
public class UnsupportedFormatException extends FluentException {

	private static final long serialVersionUID = 1L;

    public UnsupportedFormatException(String fileName) {
        super("Unsupported file format: " + fileName);
    }
}
