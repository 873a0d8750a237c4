package com.localization.toolkit.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Source text the parser could not read, with the errors that made it junk.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Junk extends FluentEntry {
    private final String content;
    private final List<Annotation> annotations;

    public Junk(String content, List<Annotation> annotations, Span span) {
        this.content = content;
        this.annotations = List.copyOf(annotations);
        this.span = span;
    }

    @Override
    public <R> R accept(FluentEntryVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
