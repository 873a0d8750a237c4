package com.localization.toolkit.model;

import lombok.Value;

@Value
public class TextElement implements PatternElement {
    String value;
}
