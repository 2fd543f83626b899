package io.github.drompincen.taskbridge.runtime.remote;

import io.github.drompincen.taskbridge.protocol.source.SourceProject;
import io.github.drompincen.taskbridge.runtime.retry.RetryExecutor;

public interface SourceExporter {

    void verifyAccess();

    /**
     * Reads a complete project, including tasks, comments and milestones.
     *
     * @param projectRef source project id, or a project name to look up
     * @param executor   executor every outbound call goes through
     */
    SourceProject exportProject(String projectRef, RetryExecutor executor);
}
