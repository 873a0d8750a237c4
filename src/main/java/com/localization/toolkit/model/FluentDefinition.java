package com.localization.toolkit.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Common shape of messages and terms: an identifier, an optional value,
 * attributes and an optional attached comment.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public abstract class FluentDefinition extends FluentEntry {
    protected Identifier id;
    protected Pattern value;
    protected List<Attribute> attributes = new ArrayList<>();
    protected Comment comment;

    /**
     * Id as written in source; terms carry their leading dash.
     */
    public abstract String getFullId();

    public boolean hasValue() {
        return value != null;
    }
}
