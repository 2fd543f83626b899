package io.github.drompincen.taskbridge.protocol.api;

import io.github.drompincen.taskbridge.protocol.source.SourceComment;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A task after transformation, still carrying human-readable names. Identifiers on the
 * destination side are resolved later by the import step.
 */
public record TransformedTask(
        String sourceId,
        String name,
        String description,
        String activityName,
        String phaseName,
        List<String> assigneeNames,
        String ownerName,
        boolean completed,
        Instant completedAt,
        LocalDate startOn,
        LocalDate dueOn,
        Integer priorityId,
        Double plannedHours,
        Double actualHours,
        List<SourceComment> comments
) {
    public TransformedTask {
        assigneeNames = assigneeNames == null ? List.of() : List.copyOf(assigneeNames);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
