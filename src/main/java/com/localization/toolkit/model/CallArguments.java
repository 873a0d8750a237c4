package com.localization.toolkit.model;

import lombok.Value;

import java.util.List;

@Value
public class CallArguments {
    List<Expression> positional;
    List<NamedArgument> named;

    public CallArguments(List<Expression> positional, List<NamedArgument> named) {
        this.positional = List.copyOf(positional);
        this.named = List.copyOf(named);
    }
}
