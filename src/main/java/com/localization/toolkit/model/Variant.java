package com.localization.toolkit.model;

import lombok.Value;

@Value
public class Variant {
    VariantKey key;
    Pattern value;
    boolean defaultVariant;
}
