package com.localization.toolkit.model;

import lombok.Value;

import java.util.List;

@Value
public class Pattern {
    List<PatternElement> elements;

    public Pattern(List<PatternElement> elements) {
        this.elements = List.copyOf(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
