package io.github.drompincen.taskbridge.protocol.api;

import java.time.LocalDate;

public record PhaseSpec(
        String title,
        PhaseType type,
        LocalDate startDate,
        LocalDate endDate
) {}
