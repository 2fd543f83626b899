package io.github.drompincen.taskbridge.protocol.api;

public record ProjectOutcome(
        String sourceProjectId,
        String projectName,
        ProjectClassification classification,
        ImportState finalState,
        Integer destinationProjectId,
        int tasksSucceeded,
        int tasksFailed
) {
    public boolean isPartial() {
        return finalState == ImportState.DONE && tasksFailed > 0;
    }
}
