package com.localization.toolkit.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localization.toolkit.storage.FluentUnit;
import com.localization.toolkit.storage.TranslationUnit;
import com.localization.toolkit.storage.exception.FluentException;
import com.localization.toolkit.tool.FileReport;
import com.localization.toolkit.tool.FluentToolConfig;
import com.localization.toolkit.tool.FluentToolResult;

/**
 * Responsible only for printing CLI output of the fluent-tool command.
 * No validation, no execution.
 */
public class FluentResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(FluentResultsPrinter.class);

    public void printBanner(FluentToolConfig config) {
        log.info("=================================================");
        log.info("Fluent Tool");
        log.info("=================================================");
        log.info("Input Files: {}", config.getInputs().size());
        for (Path input : config.getInputs()) {
            log.info("  {}", input);
        }
        log.info("Output: {}", describeOutput(config));
        log.info("List Units: {}", config.isListUnits());
        log.info("Fail Fast: {}", config.isFailFast());
        log.info("=================================================");
    }

    public void printUnits(FileReport report) {
        if (report.getStore() == null) {
            return;
        }
        log.info("");
        log.info("{} ({} units)", report.getPath().getFileName(), report.getStore().getUnits().size());
        for (TranslationUnit unit : report.getStore().getUnits()) {
            log.info("  {}", describeUnit(unit));
        }
    }

    public void printSuccess(FluentToolResult result) {
        log.info("");
        log.info("=================================================");
        log.info("ALL FILES OK");
        log.info("=================================================");
        log.info("Files Processed: {}", result.getReports().size());
        log.info("Units Read: {}", result.getUnitsRead());
        for (FileReport report : result.getReports()) {
            if (report.getWrittenTo() != null) {
                log.info("  Wrote {}", report.getWrittenTo());
            }
        }
        log.info("=================================================");
    }

    public void printFailure(FluentToolResult result) {
        log.error("{} of {} file(s) failed", result.getFilesFailed(), result.getReports().size());
        for (FileReport report : result.getReports()) {
            if (!report.isSuccess()) {
                log.error("{}:", report.getPath());
                for (String line : report.getErrorMessage().split("\n")) {
                    log.error("  {}", line);
                }
            }
        }
        if (result.getFilesSkipped() > 0) {
            log.error("{} file(s) were not processed (--fail-fast)", result.getFilesSkipped());
        }
    }

    private String describeOutput(FluentToolConfig config) {
        switch (config.getOutputMode()) {
            case STDOUT:
                return "standard output";
            case FILE:
                return config.getOutputFile().toString();
            case IN_PLACE:
                return "in place";
            default:
                return "None (check only)";
        }
    }

    String describeUnit(TranslationUnit unit) {
        if (!(unit instanceof FluentUnit fluentUnit)) {
            return unit.getId() + ": " + unit.getSource();
        }

        StringBuilder line = new StringBuilder("[").append(fluentUnit.getFluentType()).append("]");
        if (fluentUnit.getId() != null) {
            line.append(' ').append(fluentUnit.getId());
        }
        if (!fluentUnit.isHeader()) {
            try {
                if (!fluentUnit.getReferences().isEmpty()) {
                    line.append(" refs=").append(fluentUnit.getReferences());
                }
            } catch (FluentException e) {
                line.append(" (invalid source: ").append(e.getMessage().replace("\n", " ")).append(')');
            }
        }
        if (!fluentUnit.getNotes().isEmpty()) {
            line.append(" # ").append(fluentUnit.getNotes().replace("\n", " / "));
        }
        return line.toString();
    }
}
