package com.localization.toolkit.storage.exception;

import com.localization.toolkit.storage.FluentType;

/**
 * An id does not fit the syntax of its unit type.
 */
public class InvalidIdException extends FluentException {

	private static final long serialVersionUID = 1L;
	private final FluentType fluentType;
	private final String id;

    public InvalidIdException(FluentType fluentType, String id, String reason) {
        super("Invalid id " + (id == null ? "null" : "\"" + id + "\"") + " for " + fluentType.getDisplayName() + ": " + reason);
        this.fluentType = fluentType;
        this.id = id;
    }

    public FluentType getFluentType() {
        return fluentType;
    }

    public String getId() {
        return id;
    }
}
