package com.localization.toolkit.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code ###} comment about the whole resource.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ResourceComment extends BaseComment {

    public ResourceComment(String content) {
        this.content = content;
    }

    public ResourceComment(String content, Span span) {
        this.content = content;
        this.span = span;
    }

    @Override
    public <R> R accept(FluentEntryVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
