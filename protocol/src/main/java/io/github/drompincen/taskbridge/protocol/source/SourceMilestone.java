package io.github.drompincen.taskbridge.protocol.source;

import java.time.LocalDate;

public record SourceMilestone(
        String id,
        String name,
        LocalDate startOn,
        LocalDate dueOn
) {}
