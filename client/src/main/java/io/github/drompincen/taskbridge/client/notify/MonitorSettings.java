package io.github.drompincen.taskbridge.client.notify;

import java.time.Duration;

/**
 * @param url       status endpoint; blank disables notifications
 * @param idField   payload key carrying the source project id
 * @param nameField payload key carrying the source project name
 */
public record MonitorSettings(String url, Duration timeout, String idField, String nameField) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    public MonitorSettings {
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        idField = idField == null || idField.isBlank() ? "asana GID" : idField;
        nameField = nameField == null || nameField.isBlank() ? "asana project name" : nameField;
    }

    public MonitorSettings(String url, Duration timeout) {
        this(url, timeout, null, null);
    }

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }
}
