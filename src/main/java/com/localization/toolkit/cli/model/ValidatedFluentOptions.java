package com.localization.toolkit.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.localization.toolkit.tool.OutputMode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps FluentCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedFluentOptions {
    List<Path> inputs;
    OutputMode outputMode;
    Path outputFile;
}
