package com.localization.toolkit.model;

/**
 * Marker for everything that can appear inside a placeable.
 */
public interface Expression {
}
