package com.localization.toolkit.model;

import lombok.Value;

import java.util.List;

@Value
public class SelectExpression implements Expression {
    Expression selector;
    List<Variant> variants;

    public SelectExpression(Expression selector, List<Variant> variants) {
        this.selector = selector;
        this.variants = List.copyOf(variants);
    }
}
