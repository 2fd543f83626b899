package io.github.drompincen.taskbridge.client.scoro;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.taskbridge.protocol.api.PhaseType;
import io.github.drompincen.taskbridge.protocol.remote.RemoteActivity;
import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteProject;
import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads destination responses into the typed remote records. Endpoints disagree on field names
 * ({@code id} vs {@code company_id} vs {@code client_id}, numbers vs numeric strings), so all
 * of that is settled here.
 */
public final class ScoroResponseMapper {

    private ScoroResponseMapper() {
    }

    /** The payload of a response: the {@code data} member when present, the response itself otherwise. */
    public static JsonNode data(JsonNode response) {
        if (response != null && response.has("data") && !response.get("data").isNull()) {
            return response.get("data");
        }
        return response;
    }

    public static List<JsonNode> items(JsonNode response, String... collectionNames) {
        JsonNode data = data(response);
        List<JsonNode> items = new ArrayList<>();
        if (data == null) {
            return items;
        }
        JsonNode array = data.isArray() ? data : null;
        for (int i = 0; array == null && i < collectionNames.length; i++) {
            JsonNode candidate = data.get(collectionNames[i]);
            if (candidate != null && candidate.isArray()) {
                array = candidate;
            }
        }
        if (array != null) {
            array.forEach(items::add);
        }
        return items;
    }

    public static boolean isError(JsonNode response) {
        return response != null && "ERROR".equalsIgnoreCase(response.path("status").asText());
    }

    public static String errorMessage(JsonNode response) {
        JsonNode error = response.path("messages").path("error");
        if (error.isArray() && error.size() > 0) {
            List<String> parts = new ArrayList<>();
            error.forEach(e -> parts.add(e.asText()));
            return String.join("; ", parts);
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return "Unknown error";
    }

    public static Integer id(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isInt() || value.isLong()) {
                return value.asInt();
            }
            String text = value.asText().trim();
            if (text.matches("\\d+")) {
                return Integer.parseInt(text);
            }
        }
        return null;
    }

    public static RemoteUser user(JsonNode node) {
        String first = text(node, "firstname", "first_name");
        String last = text(node, "lastname", "last_name");
        String full = text(node, "full_name", "name");
        JsonNode activeNode = node.get("is_active");
        boolean active = activeNode == null || activeNode.isNull()
                || activeNode.asBoolean() || "1".equals(activeNode.asText());
        return new RemoteUser(requireId(node, "user", "id", "user_id"), first, last, full,
                text(node, "email"), active, text(node, "status"));
    }

    public static RemotePhase phase(JsonNode node) {
        return new RemotePhase(requireId(node, "phase", "id", "phase_id", "project_phase_id"),
                id(node, "project_id"),
                PhaseType.fromWire(text(node, "type")),
                text(node, "title", "name"),
                date(text(node, "start_date")),
                date(text(node, "end_date")));
    }

    public static RemoteCompany company(JsonNode node) {
        return new RemoteCompany(requireId(node, "company", "id", "company_id", "client_id", "contact_id"),
                text(node, "name", "company_name", "search_name"));
    }

    public static RemoteProject project(JsonNode node) {
        return new RemoteProject(requireId(node, "project", "id", "project_id"),
                text(node, "project_name", "name"),
                id(node, "company_id"));
    }

    public static RemoteActivity activity(JsonNode node) {
        return new RemoteActivity(requireId(node, "activity", "activity_id", "id"), text(node, "name", "title"));
    }

    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    static LocalDate date(String value) {
        if (value == null || value.length() < 10 || value.startsWith("0000")) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static int requireId(JsonNode node, String kind, String... fields) {
        Integer id = id(node, fields);
        if (id == null) {
            throw new IllegalArgumentException("No id in " + kind + " record: " + node);
        }
        return id;
    }
}
