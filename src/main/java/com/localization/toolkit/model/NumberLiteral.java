package com.localization.toolkit.model;

import lombok.Value;

@Value
public class NumberLiteral implements Expression, VariantKey {
    String value;
}
