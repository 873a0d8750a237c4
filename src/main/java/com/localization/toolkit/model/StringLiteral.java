package com.localization.toolkit.model;

import lombok.Value;

/**
 * A quoted string. {@code value} holds the raw text between the quotes, escapes included.
 */
@Value
public class StringLiteral implements Expression {
    String value;
}
