package com.localization.toolkit.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of parsing a Fluent source: entries in source order, junk included.
 */
@Value
public class FluentResource {
    List<FluentEntry> body;

    public FluentResource(List<FluentEntry> body) {
        this.body = List.copyOf(body);
    }

    public List<Junk> getJunk() {
        return body.stream()
                .filter(Junk.class::isInstance)
                .map(Junk.class::cast)
                .collect(Collectors.toList());
    }

    public boolean hasJunk() {
        return body.stream().anyMatch(Junk.class::isInstance);
    }
}
