package com.localization.toolkit.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code ##} comment starting a group of entries.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GroupComment extends BaseComment {

    public GroupComment(String content) {
        this.content = content;
    }

    public GroupComment(String content, Span span) {
        this.content = content;
        this.span = span;
    }

    @Override
    public <R> R accept(FluentEntryVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
