package com.localization.toolkit.model;

import lombok.Value;

import java.util.List;

/**
 * A parse error attached to a {@link Junk} entry. {@code code} is the error
 * code name such as {@code E0003}; the span points at the failing character.
 */
@Value
public class Annotation {
    String code;
    List<String> arguments;
    String message;
    Span span;
}
