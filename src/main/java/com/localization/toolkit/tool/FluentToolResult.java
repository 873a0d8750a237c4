package com.localization.toolkit.tool;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Result of a fluent-tool run.
 */
@Data
@Builder
public class FluentToolResult {
    @Singular
    private List<FileReport> reports;
    private int filesSkipped;

    public boolean isSuccess() {
        return reports.stream().allMatch(FileReport::isSuccess) && filesSkipped == 0;
    }

    public long getFilesFailed() {
        return reports.stream().filter(report -> !report.isSuccess()).count();
    }

    public int getUnitsRead() {
        return reports.stream()
                .filter(report -> report.getStore() != null)
                .mapToInt(report -> report.getStore().getUnits().size())
                .sum();
    }
}
