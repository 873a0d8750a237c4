package com.localization.toolkit.model;

import lombok.Value;

/**
 * {@code { -term }}, optionally with an attribute and call arguments; both may be null.
 */
@Value
public class TermReference implements Expression {
    Identifier id;
    Identifier attribute;
    CallArguments arguments;
}
