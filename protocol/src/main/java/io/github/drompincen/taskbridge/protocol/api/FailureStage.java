package io.github.drompincen.taskbridge.protocol.api;

public enum FailureStage {
    EXPORT,
    TRANSFORM,
    UPSERT_PROJECT,
    IMPORT_TASK
}
