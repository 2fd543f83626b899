package io.github.drompincen.taskbridge.protocol.api;

public enum MigrationStatus {
    PHASE1("Phase1"),
    PHASE2("Phase2"),
    PHASE3("Phase3");

    private final String label;

    MigrationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
