package com.localization.toolkit.model;

import lombok.Data;

/**
 * Base class for top-level entries of a Fluent resource.
 */
@Data
public abstract class FluentEntry {
    protected Span span;

    public abstract <R> R accept(FluentEntryVisitor<R> visitor);
}
