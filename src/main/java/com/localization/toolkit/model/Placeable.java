package com.localization.toolkit.model;

import lombok.Value;

/**
 * An expression in braces. Placeables nest, so this is also an expression.
 */
@Value
public class Placeable implements PatternElement, Expression {
    Expression expression;
}
