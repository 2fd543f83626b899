package io.github.drompincen.taskbridge.client.asana;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.taskbridge.protocol.source.SourceComment;
import io.github.drompincen.taskbridge.protocol.source.SourceMilestone;
import io.github.drompincen.taskbridge.protocol.source.SourceProject;
import io.github.drompincen.taskbridge.protocol.source.SourceTask;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import io.github.drompincen.taskbridge.runtime.remote.SourceExporter;
import io.github.drompincen.taskbridge.runtime.resolve.Names;
import io.github.drompincen.taskbridge.runtime.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports one source project with its tasks, comment stories and milestones.
 */
public class AsanaExporter implements SourceExporter {

    private static final Logger log = LoggerFactory.getLogger(AsanaExporter.class);

    static final String PROJECT_FIELDS = "gid,name,notes,start_on,due_on,due_date";
    static final String TASK_FIELDS = "gid,name,notes,resource_subtype,completed,completed_at,created_at,"
            + "start_on,due_on,assignee.name,created_by.name,memberships.project.gid,memberships.section.name,"
            + "custom_fields.name,custom_fields.display_value";
    static final String STORY_FIELDS = "gid,type,resource_subtype,text,created_at,created_by.name";

    private final AsanaClient client;

    public AsanaExporter(AsanaClient client) {
        this.client = client;
    }

    @Override
    public void verifyAccess() {
        client.get("source users/me", "users/me", Map.of("opt_fields", "gid,name"));
    }

    @Override
    public SourceProject exportProject(String projectRef, RetryExecutor executor) {
        String projectId = resolveProjectId(projectRef, executor);
        JsonNode project = client.get(executor, "source project " + projectId,
                "projects/" + projectId, Map.of("opt_fields", PROJECT_FIELDS));
        String projectName = text(project, "name");

        List<JsonNode> rawTasks = client.list(executor, "source tasks " + projectId,
                "projects/" + projectId + "/tasks", Map.of("opt_fields", TASK_FIELDS));

        List<SourceTask> tasks = new ArrayList<>();
        List<SourceMilestone> milestones = new ArrayList<>();
        for (JsonNode raw : rawTasks) {
            if ("milestone".equals(text(raw, "resource_subtype"))) {
                milestones.add(new SourceMilestone(text(raw, "gid"), text(raw, "name"),
                        date(text(raw, "start_on")), date(text(raw, "due_on"))));
                continue;
            }
            List<SourceComment> comments = comments(executor, text(raw, "gid"));
            tasks.add(task(raw, projectId, projectName, comments));
        }
        LocalDate due = date(text(project, "due_on"));
        if (due == null) {
            due = date(text(project, "due_date"));
        }
        log.info("[Export] '{}': {} tasks, {} milestones", projectName, tasks.size(), milestones.size());
        return new SourceProject(projectId, projectName, text(project, "notes"),
                date(text(project, "start_on")), due, tasks, milestones);
    }

    /** A numeric reference is a project id; anything else is looked up by name in the workspace. */
    String resolveProjectId(String projectRef, RetryExecutor executor) {
        String ref = projectRef.trim();
        if (ref.matches("\\d+")) {
            return ref;
        }
        if (!client.settings().hasWorkspace()) {
            throw RemoteApiException.rejected("source project lookup",
                    "project '" + ref + "' given by name but no workspace is configured");
        }
        String wanted = Names.normalize(ref);
        List<JsonNode> projects = client.list(executor, "source project lookup",
                "workspaces/" + client.settings().workspaceId() + "/projects", Map.of("opt_fields", "gid,name"));
        for (JsonNode project : projects) {
            if (wanted.equals(Names.normalize(text(project, "name")))) {
                return text(project, "gid");
            }
        }
        throw RemoteApiException.rejected("source project lookup", "no project named '" + ref + "'");
    }

    private List<SourceComment> comments(RetryExecutor executor, String taskId) {
        List<SourceComment> comments = new ArrayList<>();
        List<JsonNode> stories = client.list(executor, "source stories " + taskId,
                "tasks/" + taskId + "/stories", Map.of("opt_fields", STORY_FIELDS));
        for (JsonNode story : stories) {
            boolean comment = "comment".equals(text(story, "type"))
                    || "comment_added".equals(text(story, "resource_subtype"));
            String text = text(story, "text");
            if (comment && text != null) {
                comments.add(new SourceComment(story.path("created_by").path("name").asText(null),
                        text, instant(text(story, "created_at"))));
            }
        }
        return comments;
    }

    static SourceTask task(JsonNode raw, String projectId, String projectName, List<SourceComment> comments) {
        List<String> assignees = new ArrayList<>();
        String assignee = raw.path("assignee").path("name").asText(null);
        if (assignee != null && !assignee.isBlank()) {
            assignees.add(assignee);
        }
        String section = null;
        for (JsonNode membership : raw.path("memberships")) {
            String memberOf = membership.path("project").path("gid").asText(null);
            if (memberOf == null || memberOf.equals(projectId)) {
                section = membership.path("section").path("name").asText(null);
                break;
            }
        }
        Map<String, String> customFields = new LinkedHashMap<>();
        for (JsonNode field : raw.path("custom_fields")) {
            String name = text(field, "name");
            String value = text(field, "display_value");
            if (name != null && value != null) {
                customFields.put(name, value);
            }
        }
        return new SourceTask(text(raw, "gid"), text(raw, "name"), text(raw, "notes"), assignees,
                raw.path("created_by").path("name").asText(null), section,
                raw.path("completed").asBoolean(false),
                instant(text(raw, "completed_at")), instant(text(raw, "created_at")),
                date(text(raw, "start_on")), date(text(raw, "due_on")),
                customFields, comments, projectId, projectName);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return null;
        }
    }

    static LocalDate date(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date '{}'", value);
            return null;
        }
    }
}
