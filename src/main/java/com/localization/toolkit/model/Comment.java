package com.localization.toolkit.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A {@code #} comment, either attached to a message or term, or standalone.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Comment extends BaseComment {

    public Comment(String content) {
        this.content = content;
    }

    public Comment(String content, Span span) {
        this.content = content;
        this.span = span;
    }

    @Override
    public <R> R accept(FluentEntryVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
