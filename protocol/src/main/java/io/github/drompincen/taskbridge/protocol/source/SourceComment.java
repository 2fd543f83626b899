package io.github.drompincen.taskbridge.protocol.source;

import java.time.Instant;

public record SourceComment(
        String authorName,
        String text,
        Instant createdAt
) {}
