package io.github.drompincen.taskbridge.protocol.api;

public enum ProjectClassification {
    CLIENT,
    TEAM_MEMBER;

    /** Client projects take priority when the same task shows up in several projects. */
    public boolean outranks(ProjectClassification other) {
        return this == CLIENT && other == TEAM_MEMBER;
    }
}
