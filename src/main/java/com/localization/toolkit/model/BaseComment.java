package com.localization.toolkit.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Comment text with the markers removed; lines are joined with {@code \n}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public abstract class BaseComment extends FluentEntry {
    protected String content;
}
