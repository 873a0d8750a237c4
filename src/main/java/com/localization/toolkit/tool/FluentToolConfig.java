package com.localization.toolkit.tool;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for a fluent-tool run.
 */
@Data
@Builder
public class FluentToolConfig {
    private List<Path> inputs;
    private OutputMode outputMode;
    private Path outputFile;
    private boolean listUnits;
    private boolean failFast;
}
