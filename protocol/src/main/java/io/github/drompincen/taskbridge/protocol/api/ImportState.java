package io.github.drompincen.taskbridge.protocol.api;

public enum ImportState {
    RESOLVE_COMPANY,
    UPSERT_PROJECT,
    CREATE_PHASES,
    IMPORT_TASKS,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
