package io.github.drompincen.taskbridge.runtime.importer;

/**
 * @param defaultUserId  user substituted when no assignee, owner or comment author resolves
 * @param projectStatus  status given to newly created destination projects
 */
public record ImportSettings(
        int defaultUserId,
        String projectStatus
) {
    public static final String DEFAULT_PROJECT_STATUS = "inprogress";
}
