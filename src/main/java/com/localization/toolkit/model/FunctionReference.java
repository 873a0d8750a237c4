package com.localization.toolkit.model;

import lombok.Value;

@Value
public class FunctionReference implements Expression {
    Identifier id;
    CallArguments arguments;
}
