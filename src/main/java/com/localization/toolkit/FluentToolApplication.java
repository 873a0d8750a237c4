package com.localization.toolkit;

import com.localization.toolkit.cli.FluentCommand;
import picocli.CommandLine;

/**
 * Main entry point for fluent-tool.
 */
public class FluentToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FluentCommand()).execute(args);
        System.exit(exitCode);
    }
}
