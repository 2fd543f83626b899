package io.github.drompincen.taskbridge.runtime.remote;

import io.github.drompincen.taskbridge.protocol.api.MigrationStatus;

/**
 * Progress sink for the external monitor. Implementations must not let failures escape.
 */
public interface StatusNotifier {

    StatusNotifier NO_OP = (projectId, projectName, status) -> { };

    void notify(String sourceProjectId, String projectName, MigrationStatus status);
}
