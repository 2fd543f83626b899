package io.github.drompincen.taskbridge.client.asana;

public record AsanaSettings(String baseUrl, String accessToken, String workspaceId) {

    public static final String DEFAULT_BASE_URL = "https://app.asana.com/api/1.0/";

    public AsanaSettings {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        } else if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
    }

    public boolean isComplete() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasWorkspace() {
        return workspaceId != null && !workspaceId.isBlank();
    }
}
