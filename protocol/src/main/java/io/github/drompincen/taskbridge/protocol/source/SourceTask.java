package io.github.drompincen.taskbridge.protocol.source;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A work item as exported from the source system. Custom field values are kept
 * in their display form, keyed by field name.
 */
public record SourceTask(
        String id,
        String name,
        String notes,
        List<String> assigneeNames,
        String creatorName,
        String sectionName,
        boolean completed,
        Instant completedAt,
        Instant createdAt,
        LocalDate startOn,
        LocalDate dueOn,
        Map<String, String> customFields,
        List<SourceComment> comments,
        String projectId,
        String projectName
) {
    public SourceTask {
        assigneeNames = assigneeNames == null ? List.of() : List.copyOf(assigneeNames);
        customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public boolean hasAssignee() {
        return assigneeNames.stream().anyMatch(n -> n != null && !n.isBlank());
    }
}
