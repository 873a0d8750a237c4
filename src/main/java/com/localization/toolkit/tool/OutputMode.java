package com.localization.toolkit.tool;

/**
 * Where a processed file goes after it was parsed and re-serialized.
 */
public enum OutputMode {
    /** Parse and serialize only. */
    NONE,
    STDOUT,
    /** A single explicit output file. */
    FILE,
    IN_PLACE
}
