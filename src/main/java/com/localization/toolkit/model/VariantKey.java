package com.localization.toolkit.model;

/**
 * Key of a select variant: an identifier or a number literal.
 */
public interface VariantKey {
}
