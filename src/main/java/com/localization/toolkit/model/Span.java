package com.localization.toolkit.model;

import lombok.Value;

/**
 * Character offsets of a node in the parsed source, end exclusive.
 */
@Value
public class Span {
    int start;
    int end;
}
