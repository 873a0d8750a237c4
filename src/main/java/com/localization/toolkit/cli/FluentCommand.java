package com.localization.toolkit.cli;

import com.localization.toolkit.cli.exception.OptionsValidationException;
import com.localization.toolkit.cli.model.FluentOptions;
import com.localization.toolkit.cli.model.ValidatedFluentOptions;
import com.localization.toolkit.cli.output.FluentResultsPrinter;
import com.localization.toolkit.cli.validation.FluentOptionsValidator;
import com.localization.toolkit.tool.FileReport;
import com.localization.toolkit.tool.FluentTool;
import com.localization.toolkit.tool.FluentToolConfig;
import com.localization.toolkit.tool.FluentToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.OutputStream;
import java.util.concurrent.Callable;

/**
 * CLI command that checks, lists and re-serializes Fluent files.
 *
 * <p>Exit codes: 0 when every file succeeded, 1 for invalid options, 2 when
 * any file failed to parse or serialize.
 */
@Command(
        name = "fluent-tool",
        mixinStandardHelpOptions = true,
        version = "fluent-tool 1.0.0",
        exitCodeOnInvalidInput = FluentCommand.EXIT_INVALID_OPTIONS,
        description = "Parses Fluent (.ftl) localization files and writes them back in canonical form."
)
public class FluentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FluentCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_OPTIONS = 1;
    public static final int EXIT_FILE_FAILURE = 2;

    @Mixin
    private FluentOptions options = new FluentOptions();

    private final OutputStream stdout;
    private final FluentOptionsValidator validator = new FluentOptionsValidator();
    private final FluentResultsPrinter printer = new FluentResultsPrinter();

    public FluentCommand() {
        this(System.out);
    }

    public FluentCommand(OutputStream stdout) {
        this.stdout = stdout;
    }

    @Override
    public Integer call() {
        ValidatedFluentOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return EXIT_INVALID_OPTIONS;
        }

        FluentToolConfig config = FluentToolConfig.builder()
                .inputs(validated.getInputs())
                .outputMode(validated.getOutputMode())
                .outputFile(validated.getOutputFile())
                .listUnits(options.isList())
                .failFast(options.isFailFast())
                .build();

        printer.printBanner(config);

        FluentToolResult result = new FluentTool(config, stdout).run();

        if (config.isListUnits()) {
            for (FileReport report : result.getReports()) {
                printer.printUnits(report);
            }
        }

        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FILE_FAILURE;
        }

        printer.printSuccess(result);
        return EXIT_OK;
    }
}
