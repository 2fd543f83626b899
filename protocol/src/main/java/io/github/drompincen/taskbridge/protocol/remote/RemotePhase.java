package io.github.drompincen.taskbridge.protocol.remote;

import io.github.drompincen.taskbridge.protocol.api.PhaseType;

import java.time.LocalDate;

/**
 * A phase as listed by the destination. {@code projectId} is null when the listing omitted it;
 * such a phase never matches a project scope.
 */
public record RemotePhase(
        int id,
        Integer projectId,
        PhaseType type,
        String title,
        LocalDate startDate,
        LocalDate endDate
) {
    public boolean belongsTo(int destinationProjectId) {
        return projectId != null && projectId == destinationProjectId;
    }
}
