package com.localization.toolkit.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Message extends FluentDefinition {

    @Builder
    public Message(Identifier id, Pattern value, List<Attribute> attributes, Comment comment, Span span) {
        this.id = id;
        this.value = value;
        this.attributes = attributes != null ? attributes : new ArrayList<>();
        this.comment = comment;
        this.span = span;
    }

    @Override
    public String getFullId() {
        return id.getName();
    }

    @Override
    public <R> R accept(FluentEntryVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
