package com.localization.toolkit.tool;

import com.localization.toolkit.storage.StoreFactory;
import com.localization.toolkit.storage.TranslationStore;
import com.localization.toolkit.storage.exception.FluentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Runs the parse / re-serialize cycle over the configured input files.
 *
 * <p>Each file is parsed and serialized in memory before anything is
 * written, so a failing file is never partially rewritten.
 */
public class FluentTool {
    private static final Logger log = LoggerFactory.getLogger(FluentTool.class);

    private final FluentToolConfig config;
    private final StoreFactory storeFactory;
    private final OutputStream stdout;

    public FluentTool(FluentToolConfig config, OutputStream stdout) {
        this(config, new StoreFactory(), stdout);
    }

    public FluentTool(FluentToolConfig config, StoreFactory storeFactory, OutputStream stdout) {
        this.config = config;
        this.storeFactory = storeFactory;
        this.stdout = stdout;
    }

    public FluentToolResult run() {
        FluentToolResult.FluentToolResultBuilder result = FluentToolResult.builder();
        int processed = 0;

        for (Path input : config.getInputs()) {
            FileReport report = process(input);
            result.report(report);
            processed++;

            if (!report.isSuccess() && config.isFailFast()) {
                int skipped = config.getInputs().size() - processed;
                if (skipped > 0) {
                    log.warn("Stopping after failure in {}; {} file(s) not processed", input, skipped);
                }
                result.filesSkipped(skipped);
                break;
            }
        }
        return result.build();
    }

    private FileReport process(Path input) {
        log.debug("Processing {}", input);
        TranslationStore<?> store = null;

        try {
            store = storeFactory.open(input);
            byte[] data = store.serialize();
            Path target = write(input, data);

            return FileReport.builder()
                    .path(input)
                    .store(store)
                    .success(true)
                    .writtenTo(target)
                    .build();
        } catch (FluentException e) {
            log.debug("Failed to process {}", input, e);
            return FileReport.failure(input, store, e.getMessage());
        } catch (IOException | UncheckedIOException e) {
            log.debug("I/O error on {}", input, e);
            return FileReport.failure(input, store, "I/O error: " + e.getMessage());
        }
    }

    private Path write(Path input, byte[] data) throws IOException {
        switch (config.getOutputMode()) {
            case STDOUT:
                stdout.write(data);
                stdout.flush();
                return null;
            case FILE:
                storeFactory.write(data, config.getOutputFile());
                return config.getOutputFile();
            case IN_PLACE:
                storeFactory.write(data, input);
                return input;
            default:
                return null;
        }
    }
}
