package com.localization.toolkit.model;

import lombok.Value;

@Value
public class Identifier implements VariantKey {
    String name;
}
