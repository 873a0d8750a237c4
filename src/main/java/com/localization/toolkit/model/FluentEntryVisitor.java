package com.localization.toolkit.model;

/**
 * Visitor over the entry kinds of a Fluent resource.
 */
public interface FluentEntryVisitor<R> {
    R visit(Message message);
    R visit(Term term);
    R visit(Comment comment);
    R visit(GroupComment comment);
    R visit(ResourceComment comment);
    R visit(Junk junk);
}
