package io.github.drompincen.taskbridge.protocol.api;

import java.time.LocalDate;
import java.util.List;

public record TransformedProject(
        String sourceId,
        String name,
        String description,
        ProjectClassification classification,
        String companyName,
        String managerName,
        LocalDate deadline,
        List<PhaseSpec> phases,
        List<TransformedTask> tasks
) {
    public TransformedProject {
        phases = phases == null ? List.of() : List.copyOf(phases);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
