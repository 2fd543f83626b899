package io.github.drompincen.taskbridge.protocol.api;

public enum PhaseType {
    PHASE("phase"),
    MILESTONE("milestone");

    private final String wireValue;

    PhaseType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static PhaseType fromWire(String value) {
        if (value != null && value.trim().equalsIgnoreCase(MILESTONE.wireValue)) {
            return MILESTONE;
        }
        return PHASE;
    }
}
