package io.github.drompincen.taskbridge.runtime.importer;

import io.github.drompincen.taskbridge.protocol.api.CommentDraft;
import io.github.drompincen.taskbridge.protocol.api.FailureStage;
import io.github.drompincen.taskbridge.protocol.api.ImportFailure;
import io.github.drompincen.taskbridge.protocol.api.ImportState;
import io.github.drompincen.taskbridge.protocol.api.NormalizedTask;
import io.github.drompincen.taskbridge.protocol.api.PhaseSpec;
import io.github.drompincen.taskbridge.protocol.api.ProjectDraft;
import io.github.drompincen.taskbridge.protocol.api.ProjectOutcome;
import io.github.drompincen.taskbridge.protocol.api.TransformedProject;
import io.github.drompincen.taskbridge.protocol.api.TransformedTask;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteProject;
import io.github.drompincen.taskbridge.protocol.source.SourceComment;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import io.github.drompincen.taskbridge.runtime.resolve.ActivityResolver;
import io.github.drompincen.taskbridge.runtime.resolve.CompanyResolver;
import io.github.drompincen.taskbridge.runtime.resolve.Names;
import io.github.drompincen.taskbridge.runtime.resolve.PhaseResolver;
import io.github.drompincen.taskbridge.runtime.resolve.Resolution;
import io.github.drompincen.taskbridge.runtime.resolve.UserResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Imports one transformed project into the destination:
 * ResolveCompany, UpsertProject, CreatePhases, ImportTasks, then Done.
 * Only a missing destination project (or lost credentials) ends in Failed; every other
 * problem falls back and is logged, and a failing task never stops the tasks after it.
 */
@Service
public class ImportOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);
    private static final DateTimeFormatter COMMENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final DestinationApi destination;
    private final CompanyResolver companyResolver;
    private final UserResolver userResolver;
    private final PhaseResolver phaseResolver;
    private final ActivityResolver activityResolver;
    private final ImportSettings settings;

    public ImportOrchestrator(DestinationApi destination,
                              CompanyResolver companyResolver,
                              UserResolver userResolver,
                              PhaseResolver phaseResolver,
                              ActivityResolver activityResolver,
                              ImportSettings settings) {
        this.destination = destination;
        this.companyResolver = companyResolver;
        this.userResolver = userResolver;
        this.phaseResolver = phaseResolver;
        this.activityResolver = activityResolver;
        this.settings = settings;
    }

    public ProjectOutcome importProject(RunContext ctx, TransformedProject project) {
        ProjectImport run = new ProjectImport(project);
        ImportState state = ImportState.RESOLVE_COMPANY;
        while (!state.isTerminal()) {
            log.debug("[Import] {} -> {}", project.name(), state);
            state = switch (state) {
                case RESOLVE_COMPANY -> resolveCompany(ctx, run);
                case UPSERT_PROJECT -> upsertProject(ctx, run);
                case CREATE_PHASES -> createPhases(ctx, run);
                case IMPORT_TASKS -> importTasks(ctx, run);
                default -> throw new IllegalStateException("Unexpected state " + state);
            };
        }
        ProjectOutcome outcome = new ProjectOutcome(project.sourceId(), project.name(), project.classification(),
                state, run.destinationProjectId, run.succeeded, run.failed);
        ctx.summary().recordProject(outcome);
        log.info("[Import] {} finished {}: {} tasks ok, {} failed", project.name(), state, run.succeeded, run.failed);
        return outcome;
    }

    // ---- states ----

    private ImportState resolveCompany(RunContext ctx, ProjectImport run) {
        String companyName = run.project.companyName();
        if (Names.isBlank(companyName)) {
            log.warn("[Import] {}: no company name, project will have no company", run.project.name());
            return ImportState.UPSERT_PROJECT;
        }
        Resolution company = companyResolver.getOrCreate(ctx, companyName);
        if (company.isFound()) {
            run.companyId = company.id();
        } else {
            log.warn("[Import] {}: company '{}' unavailable, continuing without it", run.project.name(), companyName);
        }
        return ImportState.UPSERT_PROJECT;
    }

    private ImportState upsertProject(RunContext ctx, ProjectImport run) {
        TransformedProject project = run.project;
        try {
            Optional<RemoteProject> existing = ctx.executor()
                    .execute("projects/list", () -> destination.findProjects(project.name()))
                    .stream()
                    .filter(p -> Names.normalize(Names.unescape(p.name())).equals(Names.normalize(project.name())))
                    .findFirst();
            if (existing.isPresent()) {
                run.destinationProjectId = existing.get().id();
                log.info("[Import] {}: reusing destination project {}", project.name(), run.destinationProjectId);
                return ImportState.CREATE_PHASES;
            }
            Integer managerId = resolveManager(ctx, project);
            ProjectDraft draft = new ProjectDraft(project.name(), project.description(), run.companyId, managerId,
                    settings.projectStatus(), project.deadline());
            RemoteProject created = ctx.executor().execute("projects/modify", () -> destination.createProject(draft));
            run.destinationProjectId = created.id();
            log.info("[Import] {}: created destination project {}", project.name(), created.id());
            return ImportState.CREATE_PHASES;
        } catch (RemoteApiException e) {
            log.error("[Import] {}: could not create or find destination project", project.name(), e);
            ctx.summary().recordProjectFailure(ImportFailure.project(project.sourceId(), project.name(),
                    FailureStage.UPSERT_PROJECT, e.getMessage()));
            return ImportState.FAILED;
        }
    }

    private Integer resolveManager(RunContext ctx, TransformedProject project) {
        if (Names.isBlank(project.managerName())) {
            return null;
        }
        try {
            Integer managerId = userResolver.resolve(ctx, project.managerName()).id();
            if (managerId == null) {
                log.warn("[Import] {}: manager '{}' not found, project will have no manager",
                        project.name(), project.managerName());
            }
            return managerId;
        } catch (RemoteApiException e) {
            log.warn("[Import] {}: could not look up manager '{}': {}",
                    project.name(), project.managerName(), e.getMessage());
            return null;
        }
    }

    private ImportState createPhases(RunContext ctx, ProjectImport run) {
        if (run.project.phases().isEmpty()) {
            return ImportState.IMPORT_TASKS;
        }
        int projectId = run.destinationProjectId;
        try {
            List<RemotePhase> existing = phaseResolver.phasesOf(ctx, projectId);
            Set<String> existingTitles = existing.stream()
                    .map(p -> Names.normalize(Names.unescape(p.title())))
                    .collect(Collectors.toSet());
            List<PhaseSpec> additions = run.project.phases().stream()
                    .filter(p -> !existingTitles.contains(Names.normalize(Names.unescape(p.title()))))
                    .toList();
            if (additions.isEmpty()) {
                return ImportState.IMPORT_TASKS;
            }
            try {
                ctx.executor().run("projects/modify phases", () -> destination.addPhases(projectId, existing, additions));
                log.info("[Import] {}: added {} phases", run.project.name(), additions.size());
            } catch (RemoteApiException e) {
                log.warn("[Import] {}: could not add {} phases, tasks in them get no phase: {}",
                        run.project.name(), additions.size(), e.getMessage());
                ctx.summary().recordPhaseFailures(additions.size());
            }
        } catch (RemoteApiException e) {
            log.warn("[Import] {}: could not list phases: {}", run.project.name(), e.getMessage());
            ctx.summary().recordPhaseFailures(run.project.phases().size());
        }
        phaseResolver.invalidate(ctx, projectId);
        return ImportState.IMPORT_TASKS;
    }

    private ImportState importTasks(RunContext ctx, ProjectImport run) {
        for (TransformedTask task : run.project.tasks()) {
            ctx.summary().recordAttempt();
            try {
                NormalizedTask normalized = normalize(ctx, run, task);
                int taskId = createTask(ctx, normalized);
                attachComments(ctx, task, taskId);
                ctx.summary().recordSuccess();
                run.succeeded++;
            } catch (RuntimeException e) {
                run.failed++;
                log.error("[Import] {}: task '{}' ({}) failed", run.project.name(), task.name(), task.sourceId(), e);
                ctx.summary().recordTaskFailure(new ImportFailure(run.project.sourceId(), run.project.name(),
                        task.sourceId(), task.name(), FailureStage.IMPORT_TASK, e.getMessage()));
                if (e instanceof RemoteApiException remote && remote.isAuthFailure()) {
                    log.error("[Import] {}: destination refused credentials, abandoning project", run.project.name());
                    return ImportState.FAILED;
                }
            }
        }
        return ImportState.DONE;
    }

    // ---- task steps ----

    private NormalizedTask normalize(RunContext ctx, ProjectImport run, TransformedTask task) {
        int fallbackUser = settings.defaultUserId();

        Integer activityId = activityResolver.resolve(ctx, task.activityName()).id();
        if (activityId == null) {
            log.warn("[Import] task '{}': no activity '{}' or fallback in destination, omitting",
                    task.name(), task.activityName());
        }

        List<Integer> assignees = userResolver.resolveAll(ctx, task.assigneeNames());
        if (assignees.isEmpty()) {
            if (!task.assigneeNames().isEmpty()) {
                log.warn("[Import] task '{}': assignees {} not found, assigning user {}",
                        task.name(), task.assigneeNames(), fallbackUser);
            }
            assignees = List.of(fallbackUser);
        }

        Resolution owner = userResolver.resolve(ctx, task.ownerName());
        int ownerId = owner.isFound() ? owner.id() : assignees.get(0);

        Integer phaseId = null;
        if (task.phaseName() != null) {
            phaseId = phaseResolver.resolve(ctx, run.destinationProjectId, task.phaseName()).id();
            if (phaseId == null) {
                log.warn("[Import] task '{}': phase '{}' not in project {}, importing without phase",
                        task.name(), task.phaseName(), run.destinationProjectId);
            }
        }

        return new NormalizedTask(task.sourceId(), task.name(), task.description(), run.destinationProjectId,
                activityId, phaseId, ownerId, assignees, task.completed(), task.completedAt(),
                task.startOn(), task.dueOn(), task.priorityId(), task.plannedHours(), task.actualHours());
    }

    /**
     * Creates the task. A non-transient rejection of a task carrying resolved users is retried
     * once with the fallback user, since the destination refuses some users its own listing returns.
     */
    private int createTask(RunContext ctx, NormalizedTask task) {
        try {
            return ctx.executor().execute("tasks/modify", () -> destination.createTask(task));
        } catch (RemoteApiException e) {
            int fallbackUser = settings.defaultUserId();
            boolean onlyFallback = task.ownerId() == fallbackUser
                    && task.relatedUserIds().stream().allMatch(id -> id == fallbackUser);
            if (e.isTransient() || e.isAuthFailure() || onlyFallback) {
                throw e;
            }
            log.warn("[Import] task '{}' rejected ({}), retrying once with user {}",
                    task.eventName(), e.getMessage(), fallbackUser);
            NormalizedTask retry = task.withUsers(fallbackUser, List.of(fallbackUser));
            int id = ctx.executor().execute("tasks/modify", () -> destination.createTask(retry));
            ctx.summary().recordFallbackRetry();
            return id;
        }
    }

    private void attachComments(RunContext ctx, TransformedTask task, int taskId) {
        for (SourceComment comment : task.comments()) {
            if (Names.isBlank(comment.text())) {
                continue;
            }
            Resolution author = commentAuthor(ctx, task, comment);
            String text = author.isFound() ? comment.text() : attributed(comment);
            CommentDraft draft = new CommentDraft(taskId, text, author.orElse(settings.defaultUserId()));
            try {
                ctx.executor().execute("comments/modify", () -> destination.createComment(draft));
            } catch (RemoteApiException e) {
                log.warn("[Import] comment on task '{}' failed: {}", task.name(), e.getMessage());
                ctx.summary().recordCommentFailure();
            }
        }
    }

    private Resolution commentAuthor(RunContext ctx, TransformedTask task, SourceComment comment) {
        try {
            return userResolver.resolve(ctx, comment.authorName());
        } catch (RemoteApiException e) {
            log.warn("[Import] comment on task '{}': could not look up author '{}', posting as user {}: {}",
                    task.name(), comment.authorName(), settings.defaultUserId(), e.getMessage());
            return Resolution.NOT_FOUND;
        }
    }

    static String attributed(SourceComment comment) {
        String who = Names.isBlank(comment.authorName()) ? "Unknown" : comment.authorName().trim();
        if (comment.createdAt() == null) {
            return "[" + who + "]: " + comment.text();
        }
        String when = COMMENT_TIME.format(comment.createdAt().atZone(ZoneOffset.UTC));
        return "[" + who + " - " + when + "]: " + comment.text();
    }

    /** Mutable per-project state while the machine runs. */
    static final class ProjectImport {
        private final TransformedProject project;
        private Integer companyId;
        private Integer destinationProjectId;
        private int succeeded;
        private int failed;

        ProjectImport(TransformedProject project) {
            this.project = project;
        }
    }
}
