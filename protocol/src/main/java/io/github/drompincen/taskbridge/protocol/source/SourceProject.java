package io.github.drompincen.taskbridge.protocol.source;

import java.time.LocalDate;
import java.util.List;

public record SourceProject(
        String id,
        String name,
        String notes,
        LocalDate startOn,
        LocalDate dueOn,
        List<SourceTask> tasks,
        List<SourceMilestone> milestones
) {
    public SourceProject {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
    }
}
