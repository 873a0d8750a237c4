package com.localization.toolkit.model;

import lombok.Value;

@Value
public class VariableReference implements Expression {
    Identifier id;
}
