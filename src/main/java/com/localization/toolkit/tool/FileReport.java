package com.localization.toolkit.tool;

import com.localization.toolkit.storage.TranslationStore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Outcome for one input file. {@code store} is set when the file parsed.
 */
@Value
@Builder
public class FileReport {
    Path path;
    TranslationStore<?> store;
    boolean success;
    String errorMessage;
    Path writtenTo;

    public static FileReport failure(Path path, TranslationStore<?> store, String errorMessage) {
        return FileReport.builder()
                .path(path)
                .store(store)
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
