package io.github.drompincen.taskbridge.protocol.api;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Destination-shaped task. {@code relatedUserIds} is never empty: when no assignee resolves
 * it holds the fallback user.
 */
public record NormalizedTask(
        String sourceId,
        String eventName,
        String description,
        int projectId,
        Integer activityId,
        Integer phaseId,
        int ownerId,
        List<Integer> relatedUserIds,
        boolean completed,
        Instant completedAt,
        LocalDate startOn,
        LocalDate dueOn,
        Integer priorityId,
        Double plannedHours,
        Double actualHours
) {
    public NormalizedTask {
        if (relatedUserIds == null || relatedUserIds.isEmpty()) {
            throw new IllegalArgumentException("relatedUserIds must not be empty for task " + sourceId);
        }
        relatedUserIds = List.copyOf(relatedUserIds);
    }

    public NormalizedTask withUsers(int owner, List<Integer> related) {
        return new NormalizedTask(sourceId, eventName, description, projectId, activityId, phaseId,
                owner, related, completed, completedAt, startOn, dueOn, priorityId, plannedHours, actualHours);
    }
}
