package com.localization.toolkit.model;

import lombok.Value;

@Value
public class Attribute {
    Identifier id;
    Pattern value;
}
