package com.localization.toolkit.model;

import lombok.Value;

/**
 * {@code name: value}; the value is a string or number literal.
 */
@Value
public class NamedArgument {
    Identifier name;
    Expression value;
}
