package com.localization.toolkit.model;

/**
 * Element of a pattern: literal text or a placeable.
 */
public interface PatternElement {
}
