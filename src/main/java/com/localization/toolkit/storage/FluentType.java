package com.localization.toolkit.storage;

/**
 * Kinds of unit a Fluent file is split into.
 */
public enum FluentType {
    MESSAGE("Message"),
    TERM("Term"),
    RESOURCE_COMMENT("ResourceComment"),
    GROUP_COMMENT("GroupComment"),
    DETACHED_COMMENT("DetachedComment");

    private final String displayName;

    FluentType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isComment() {
        return this == RESOURCE_COMMENT || this == GROUP_COMMENT || this == DETACHED_COMMENT;
    }

    /**
     * Infers Message or Term from the shape of an id.
     */
    public static FluentType fromId(String id) {
        return id != null && id.startsWith("-") ? TERM : MESSAGE;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
