package io.github.drompincen.taskbridge.runtime.dedup;

public enum DedupDecision {
    ACCEPT,
    ALREADY_ASSIGNED_ELSEWHERE
}
