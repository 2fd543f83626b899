package io.github.drompincen.taskbridge.runtime.resolve;

public enum EntityKind {
    USER,
    PHASE,
    COMPANY,
    ACTIVITY
}
