package com.localization.toolkit.storage.exception;

import com.localization.toolkit.model.Junk;

import java.util.List;

/**
 * A Fluent file contained text the parser could not read.
 * Holds every junk entry of the file; the message lists each error with its position.
 */
public class FluentParseException extends FluentException {

	private static final long serialVersionUID = 1L;
	private final transient List<Junk> junk;

    public FluentParseException(String message, List<Junk> junk) {
        super(message);
        this.junk = List.copyOf(junk);
    }

    public List<Junk> getJunk() {
        return junk;
    }
}
