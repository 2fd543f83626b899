package io.github.drompincen.taskbridge.protocol.api;

/**
 * One failed unit of work. {@code taskId} and {@code taskName} are null for project-level failures.
 */
public record ImportFailure(
        String projectId,
        String projectName,
        String taskId,
        String taskName,
        FailureStage stage,
        String message
) {
    public static ImportFailure project(String projectId, String projectName, FailureStage stage, String message) {
        return new ImportFailure(projectId, projectName, null, null, stage, message);
    }

    public boolean isProjectFailure() {
        return taskId == null;
    }
}
