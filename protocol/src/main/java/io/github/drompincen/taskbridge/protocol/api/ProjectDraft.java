package io.github.drompincen.taskbridge.protocol.api;

import java.time.LocalDate;

public record ProjectDraft(
        String name,
        String description,
        Integer companyId,
        Integer managerId,
        String status,
        LocalDate deadline
) {}
