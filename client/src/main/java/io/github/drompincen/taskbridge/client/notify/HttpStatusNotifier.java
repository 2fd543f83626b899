package io.github.drompincen.taskbridge.client.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.taskbridge.client.http.JsonTransport;
import io.github.drompincen.taskbridge.protocol.api.MigrationStatus;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import io.github.drompincen.taskbridge.runtime.remote.StatusNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;

/**
 * Posts per-project progress to the monitoring endpoint. Best effort: a single attempt with a
 * short timeout, failures logged and dropped.
 */
public class HttpStatusNotifier implements StatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(HttpStatusNotifier.class);

    private final JsonTransport transport;
    private final MonitorSettings settings;

    public HttpStatusNotifier(JsonTransport transport, MonitorSettings settings) {
        this.transport = transport;
        this.settings = settings;
    }

    @Override
    public void notify(String sourceProjectId, String projectName, MigrationStatus status) {
        if (!settings.isEnabled()) {
            return;
        }
        ObjectNode body = transport.mapper().createObjectNode();
        body.put(settings.idField(), sourceProjectId);
        body.put("status", status.label());
        body.put(settings.nameField(), projectName);
        try {
            transport.post("status notification", URI.create(settings.url()), body, Map.of());
            log.debug("[Monitor] {} -> {}", projectName, status.label());
        } catch (RemoteApiException | IllegalArgumentException e) {
            log.warn("[Monitor] could not report {} for '{}': {}", status.label(), projectName, e.getMessage());
        }
    }
}
