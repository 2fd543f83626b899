package io.github.drompincen.taskbridge.client.scoro;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.taskbridge.client.http.JsonTransport;
import io.github.drompincen.taskbridge.protocol.api.CommentDraft;
import io.github.drompincen.taskbridge.protocol.api.NormalizedTask;
import io.github.drompincen.taskbridge.protocol.api.PhaseSpec;
import io.github.drompincen.taskbridge.protocol.api.ProjectDraft;
import io.github.drompincen.taskbridge.protocol.remote.RemoteActivity;
import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteProject;
import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Destination API v2 client. Every call is a POST of the envelope
 * {@code {lang, company_account_id, apiKey, request}}; errors may come back as HTTP 200 with
 * {@code "status":"ERROR"}.
 */
public class ScoroClient implements DestinationApi {

    private static final Logger log = LoggerFactory.getLogger(ScoroClient.class);

    static final int PAGE_SIZE = 100;
    private static final int MAX_PAGES = 100;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private final JsonTransport transport;
    private final ScoroSettings settings;

    public ScoroClient(JsonTransport transport, ScoroSettings settings) {
        this.transport = transport;
        this.settings = settings;
    }

    // ---- reads ----

    @Override
    public void verifyAccess() {
        ObjectNode envelope = envelope(transport.mapper().createObjectNode());
        envelope.put("per_page", "1");
        call("users/list", envelope);
    }

    @Override
    public List<RemoteUser> listUsers() {
        return listAll("users/list", transport.mapper().createObjectNode(), ScoroResponseMapper::user, "users");
    }

    @Override
    public List<RemotePhase> listPhases(int projectId) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.putObject("filters").put("project_id", projectId);
        return listAll("projectPhases/list", request, ScoroResponseMapper::phase, "phases");
    }

    @Override
    public List<RemoteCompany> listCompanies() {
        return listAll("companies/list", transport.mapper().createObjectNode(), ScoroResponseMapper::company,
                "companies", "contacts");
    }

    @Override
    public List<RemoteActivity> listActivities() {
        return listAll("activities/list", transport.mapper().createObjectNode(), ScoroResponseMapper::activity,
                "activities");
    }

    @Override
    public List<RemoteProject> findProjects(String name) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.putObject("filters").put("project_name", name);
        return listAll("projects/list", request, ScoroResponseMapper::project, "projects");
    }

    // ---- writes ----

    @Override
    public RemoteCompany createCompany(String name) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.put("name", name);
        JsonNode data = ScoroResponseMapper.data(call("companies/modify", envelope(request)));
        return created("companies/modify", data, ScoroResponseMapper::company);
    }

    @Override
    public RemoteProject createProject(ProjectDraft draft) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.put("project_name", draft.name());
        putIfPresent(request, "description", draft.description());
        if (draft.companyId() != null) {
            request.put("company_id", draft.companyId());
        }
        if (draft.managerId() != null) {
            request.put("manager_id", draft.managerId());
        }
        putIfPresent(request, "status", draft.status());
        if (draft.deadline() != null) {
            request.put("deadline", draft.deadline().toString());
        }
        JsonNode data = ScoroResponseMapper.data(call("projects/modify", envelope(request)));
        RemoteProject project = created("projects/modify", data, ScoroResponseMapper::project);
        return project.name() == null ? new RemoteProject(project.id(), draft.name(), draft.companyId()) : project;
    }

    @Override
    public void addPhases(int projectId, List<RemotePhase> existing, List<PhaseSpec> additions) {
        ObjectNode request = transport.mapper().createObjectNode();
        ArrayNode phases = request.putArray("phases");
        for (RemotePhase phase : existing) {
            ObjectNode node = phases.addObject();
            node.put("id", phase.id());
            node.put("type", phase.type().wireValue());
            putIfPresent(node, "title", phase.title());
            putDate(node, "start_date", phase.startDate());
            putDate(node, "end_date", phase.endDate());
        }
        for (PhaseSpec phase : additions) {
            ObjectNode node = phases.addObject();
            node.put("type", phase.type().wireValue());
            node.put("title", phase.title());
            putDate(node, "start_date", phase.startDate());
            putDate(node, "end_date", phase.endDate());
        }
        call("projects/modify/" + projectId, envelope(request));
    }

    @Override
    public int createTask(NormalizedTask task) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.put("event_name", task.eventName());
        putIfPresent(request, "description", task.description());
        request.put("project_id", task.projectId());
        if (task.phaseId() != null) {
            request.put("project_phase_id", task.phaseId());
        }
        if (task.activityId() != null) {
            request.put("activity_id", task.activityId());
        }
        request.put("owner_id", task.ownerId());
        ArrayNode related = request.putArray("related_users");
        task.relatedUserIds().forEach(related::add);
        request.put("is_personal", false);
        request.put("is_completed", task.completed());
        request.put("status", task.completed() ? "task_status4" : "task_status1");
        if (task.completed() && task.completedAt() != null) {
            request.put("datetime_completed", dateTime(task.completedAt()));
        }
        if (task.startOn() != null) {
            request.put("start_datetime", dateTime(task.startOn()));
        }
        if (task.dueOn() != null) {
            request.put("datetime_due", dateTime(task.dueOn()));
        }
        if (task.priorityId() != null) {
            request.put("priority_id", task.priorityId());
        }
        if (task.plannedHours() != null) {
            request.put("duration_planned", duration(task.plannedHours()));
            request.put("billable_time_type", "billable");
        }
        if (task.actualHours() != null) {
            request.put("duration_actual", duration(task.actualHours()));
        }
        JsonNode data = ScoroResponseMapper.data(call("tasks/modify", envelope(request)));
        Integer id = ScoroResponseMapper.id(data, "event_id", "task_id", "id");
        if (id == null) {
            throw RemoteApiException.rejected("tasks/modify", "response carried no task id");
        }
        return id;
    }

    @Override
    public int createComment(CommentDraft comment) {
        ObjectNode request = transport.mapper().createObjectNode();
        request.put("module", "tasks");
        request.put("object_id", String.valueOf(comment.taskId()));
        request.put("comment", comment.text());
        request.put("user_id", comment.userId());
        JsonNode data = ScoroResponseMapper.data(call("comments/modify", envelope(request)));
        Integer id = ScoroResponseMapper.id(data, "comment_id", "id");
        return id == null ? 0 : id;
    }

    // ---- plumbing ----

    ObjectNode envelope(JsonNode request) {
        ObjectNode envelope = transport.mapper().createObjectNode();
        envelope.put("lang", settings.lang());
        envelope.put("company_account_id", settings.companyAccount());
        envelope.put("apiKey", settings.apiKey());
        envelope.set("request", request);
        return envelope;
    }

    private JsonNode call(String endpoint, ObjectNode envelope) {
        JsonNode response = transport.post(endpoint, URI.create(settings.baseUrl() + endpoint), envelope, Map.of());
        if (ScoroResponseMapper.isError(response)) {
            throw RemoteApiException.rejected(endpoint, ScoroResponseMapper.errorMessage(response));
        }
        return response;
    }

    /** Maps a create response; one without an id counts as a rejection. */
    private static <T> T created(String endpoint, JsonNode data, Function<JsonNode, T> mapper) {
        try {
            return mapper.apply(data);
        } catch (IllegalArgumentException e) {
            throw RemoteApiException.rejected(endpoint, "response carried no id");
        }
    }

    private <T> List<T> listAll(String endpoint, ObjectNode request, Function<JsonNode, T> mapper,
                                String... collectionNames) {
        List<T> all = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            ObjectNode envelope = envelope(request.deepCopy());
            envelope.put("page", String.valueOf(page));
            envelope.put("per_page", String.valueOf(PAGE_SIZE));
            JsonNode response = transport.post(endpoint, URI.create(settings.baseUrl() + endpoint), envelope, Map.of());
            if (ScoroResponseMapper.isError(response)) {
                String message = ScoroResponseMapper.errorMessage(response);
                if (page > 1 && message.toLowerCase(Locale.ROOT).contains("page")) {
                    break;
                }
                throw RemoteApiException.rejected(endpoint, message);
            }
            List<JsonNode> items = ScoroResponseMapper.items(response, collectionNames);
            for (JsonNode item : items) {
                try {
                    all.add(mapper.apply(item));
                } catch (IllegalArgumentException e) {
                    log.warn("{}: skipping record: {}", endpoint, e.getMessage());
                }
            }
            if (items.size() < PAGE_SIZE) {
                break;
            }
        }
        log.debug("{} returned {} records", endpoint, all.size());
        return all;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isBlank()) {
            node.put(field, value);
        }
    }

    private static void putDate(ObjectNode node, String field, LocalDate date) {
        if (date != null) {
            node.put(field, date.toString());
        }
    }

    static String dateTime(Instant instant) {
        return DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }

    static String dateTime(LocalDate date) {
        return DATE_TIME.format(date.atStartOfDay().atOffset(ZoneOffset.UTC));
    }

    /** Hours as {@code HH:mm:ss}. */
    static String duration(double hours) {
        long seconds = Math.round(hours * 3600);
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
