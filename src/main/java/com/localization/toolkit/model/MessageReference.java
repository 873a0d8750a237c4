package com.localization.toolkit.model;

import lombok.Value;

/**
 * {@code { message }} or {@code { message.attribute }}. The attribute may be null.
 */
@Value
public class MessageReference implements Expression {
    Identifier id;
    Identifier attribute;
}
