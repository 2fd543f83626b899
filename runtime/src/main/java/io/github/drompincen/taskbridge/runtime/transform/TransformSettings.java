package io.github.drompincen.taskbridge.runtime.transform;

import java.time.LocalDate;

/**
 * @param cutoffDate          tasks created before this date need both an assignee and a due date
 * @param maxTasksPerProject  0 for no limit
 */
public record TransformSettings(
        LocalDate cutoffDate,
        int maxTasksPerProject
) {
    public static final LocalDate DEFAULT_CUTOFF = LocalDate.of(2010, 7, 1);

    public static TransformSettings defaults() {
        return new TransformSettings(DEFAULT_CUTOFF, 0);
    }
}
