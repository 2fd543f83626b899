package io.github.drompincen.taskbridge.protocol.api;

public record CommentDraft(
        int taskId,
        String text,
        int userId
) {}
