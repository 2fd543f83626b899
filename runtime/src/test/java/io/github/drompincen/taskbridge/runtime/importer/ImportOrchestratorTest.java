package io.github.drompincen.taskbridge.runtime.importer;

import io.github.drompincen.taskbridge.protocol.api.CommentDraft;
import io.github.drompincen.taskbridge.protocol.api.FailureStage;
import io.github.drompincen.taskbridge.protocol.api.ImportState;
import io.github.drompincen.taskbridge.protocol.api.NormalizedTask;
import io.github.drompincen.taskbridge.protocol.api.PhaseSpec;
import io.github.drompincen.taskbridge.protocol.api.PhaseType;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.protocol.api.ProjectDraft;
import io.github.drompincen.taskbridge.protocol.api.ProjectOutcome;
import io.github.drompincen.taskbridge.protocol.api.TransformedProject;
import io.github.drompincen.taskbridge.protocol.api.TransformedTask;
import io.github.drompincen.taskbridge.protocol.remote.RemoteActivity;
import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteProject;
import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;
import io.github.drompincen.taskbridge.protocol.source.SourceComment;
import io.github.drompincen.taskbridge.runtime.TestFixtures;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import io.github.drompincen.taskbridge.runtime.resolve.ActivityResolver;
import io.github.drompincen.taskbridge.runtime.resolve.CompanyResolver;
import io.github.drompincen.taskbridge.runtime.resolve.PhaseResolver;
import io.github.drompincen.taskbridge.runtime.resolve.UserResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImportOrchestratorTest {

    private static final int FALLBACK_USER = 99;
    private static final String UNKNOWN_ASSIGNEE = "Nobody";

    @Mock private DestinationApi destination;
    @Captor private ArgumentCaptor<NormalizedTask> taskCaptor;
    @Captor private ArgumentCaptor<CommentDraft> commentCaptor;

    private ImportOrchestrator orchestrator;
    private RunContext ctx;

    @BeforeEach
    void setUp() {
        orchestrator = new ImportOrchestrator(destination,
                new CompanyResolver(destination),
                new UserResolver(destination),
                new PhaseResolver(destination),
                new ActivityResolver(destination),
                new ImportSettings(FALLBACK_USER, ImportSettings.DEFAULT_PROJECT_STATUS));
        ctx = TestFixtures.context();

        when(destination.listUsers()).thenReturn(List.of(
                new RemoteUser(7, "Jane", "Doe", "Jane Doe", "jane@example.com", true, "active"),
                new RemoteUser(8, "Sam", "Lee", "Sam Lee", "sam@example.com", true, "active")));
        when(destination.listActivities()).thenReturn(List.of(
                new RemoteActivity(1, "SEO"), new RemoteActivity(2, "Other")));
        when(destination.listCompanies()).thenReturn(List.of(new RemoteCompany(10, "Acme")));
        when(destination.findProjects(anyString())).thenReturn(List.of());
        when(destination.createProject(any())).thenReturn(new RemoteProject(104, "Acme", 10));
        when(destination.listPhases(anyInt())).thenReturn(List.of(
                new RemotePhase(501, 33, PhaseType.PHASE, "Website Design", null, null),
                new RemotePhase(502, 104, PhaseType.PHASE, "Design", null, null)));
        when(destination.createTask(any())).thenReturn(1000);
        when(destination.createComment(any())).thenReturn(2000);
    }

    @Test
    void importsProjectThroughAllStates() {
        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "Write copy", "SEO", "Design", "Jane Doe")));

        assertThat(outcome.finalState()).isEqualTo(ImportState.DONE);
        assertThat(outcome.destinationProjectId()).isEqualTo(104);
        assertThat(outcome.tasksSucceeded()).isEqualTo(1);

        ArgumentCaptor<ProjectDraft> draft = ArgumentCaptor.forClass(ProjectDraft.class);
        verify(destination).createProject(draft.capture());
        assertThat(draft.getValue().companyId()).isEqualTo(10);
        assertThat(draft.getValue().managerId()).isEqualTo(8);
        assertThat(draft.getValue().status()).isEqualTo("inprogress");

        verify(destination).createTask(taskCaptor.capture());
        NormalizedTask sent = taskCaptor.getValue();
        assertThat(sent.projectId()).isEqualTo(104);
        assertThat(sent.activityId()).isEqualTo(1);
        assertThat(sent.phaseId()).isEqualTo(502);
        assertThat(sent.ownerId()).isEqualTo(7);
        assertThat(sent.relatedUserIds()).containsExactly(7);
    }

    @Test
    void unresolvedAssigneeFallsBackToDefaultUser() {
        orchestrator.importProject(ctx, project(List.of(), task("t1", "Logo", "Branding", null, "Someone Unknown")));

        verify(destination).createTask(taskCaptor.capture());
        assertThat(taskCaptor.getValue().relatedUserIds()).containsExactly(FALLBACK_USER);
        assertThat(taskCaptor.getValue().ownerId()).isEqualTo(FALLBACK_USER);
        assertThat(taskCaptor.getValue().activityId()).isEqualTo(2);
    }

    @Test
    void phaseOfAnotherProjectIsNotUsed() {
        orchestrator.importProject(ctx, project(List.of(), task("t1", "Homepage", "SEO", "Website Design", "Jane Doe")));

        verify(destination).createTask(taskCaptor.capture());
        assertThat(taskCaptor.getValue().phaseId()).isNull();
        assertThat(taskCaptor.getValue().projectId()).isEqualTo(104);
    }

    @Test
    void failingTaskDoesNotStopTheRest() {
        when(destination.createTask(argThat(t -> t != null && t.sourceId().equals("t2"))))
                .thenThrow(RemoteApiException.httpStatus("tasks/modify", 500, "server error"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(),
                task("t1", "One", "SEO", null, "Jane Doe"),
                task("t2", "Two", "SEO", null, UNKNOWN_ASSIGNEE),
                task("t3", "Three", "SEO", null, "Jane Doe")));

        assertThat(outcome.finalState()).isEqualTo(ImportState.DONE);
        assertThat(outcome.tasksSucceeded()).isEqualTo(2);
        assertThat(outcome.tasksFailed()).isEqualTo(1);
        assertThat(outcome.isPartial()).isTrue();
        assertThat(ctx.summary().getFailures()).singleElement().satisfies(f -> {
            assertThat(f.taskId()).isEqualTo("t2");
            assertThat(f.stage()).isEqualTo(FailureStage.IMPORT_TASK);
        });
        verify(destination, times(5)).createTask(any());
    }

    @Test
    void rejectedUserIsRetriedOnceWithFallback() {
        when(destination.createTask(argThat(t -> t != null && t.ownerId() == 7)))
                .thenThrow(RemoteApiException.rejected("tasks/modify", "user_id is not valid"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "One", "SEO", null, "Jane Doe")));

        assertThat(outcome.tasksSucceeded()).isEqualTo(1);
        assertThat(ctx.summary().getFallbackRetries()).isEqualTo(1);
        verify(destination, times(2)).createTask(taskCaptor.capture());
        assertThat(taskCaptor.getAllValues().get(1).relatedUserIds()).containsExactly(FALLBACK_USER);
    }

    @Test
    void projectCreationFailureFailsProjectWithoutTasks() {
        when(destination.createProject(any())).thenThrow(RemoteApiException.rejected("projects/modify", "refused"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "One", "SEO", null, "Jane Doe")));

        assertThat(outcome.finalState()).isEqualTo(ImportState.FAILED);
        assertThat(outcome.destinationProjectId()).isNull();
        verify(destination, never()).createTask(any());
        assertThat(ctx.summary().getFailures()).singleElement()
                .satisfies(f -> assertThat(f.stage()).isEqualTo(FailureStage.UPSERT_PROJECT));
    }

    @Test
    void companyFailureStillCreatesProject() {
        when(destination.listCompanies()).thenThrow(RemoteApiException.httpStatus("companies/list", 400, "bad"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "One", "SEO", null, "Jane Doe")));

        assertThat(outcome.finalState()).isEqualTo(ImportState.DONE);
    }

    @Test
    void existingProjectIsReused() {
        when(destination.findProjects("Acme")).thenReturn(List.of(new RemoteProject(77, "acme", null)));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "One", "SEO", null, "Jane Doe")));

        assertThat(outcome.destinationProjectId()).isEqualTo(77);
        verify(destination, never()).createProject(any());
    }

    @Test
    void onlyMissingPhasesAreAddedAndFailureIsNotFatal() {
        List<PhaseSpec> phases = List.of(
                new PhaseSpec("design", PhaseType.PHASE, null, null),
                new PhaseSpec("Launch", PhaseType.MILESTONE, null, null));
        doThrow(RemoteApiException.rejected("projects/modify", "bad dates"))
                .when(destination).addPhases(eq(104), any(), any());

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(phases, task("t1", "One", "SEO", "Launch", "Jane Doe")));

        verify(destination).addPhases(eq(104),
                argThat(existing -> existing.size() == 1 && existing.get(0).id() == 502),
                argThat(added -> added.size() == 1 && added.get(0).title().equals("Launch")));
        assertThat(outcome.finalState()).isEqualTo(ImportState.DONE);
        assertThat(ctx.summary().getPhaseFailures()).isEqualTo(1);
        verify(destination).createTask(taskCaptor.capture());
        assertThat(taskCaptor.getValue().phaseId()).isNull();
    }

    @Test
    void commentsAreAttributedAndBestEffort() {
        TransformedTask withComments = new TransformedTask("t1", "One", null, "SEO", null, List.of("Jane Doe"), "Jane Doe",
                false, null, null, null, 2, null, null, List.of(
                new SourceComment("Sam Lee", "Looks good", Instant.parse("2024-01-02T09:30:00Z")),
                new SourceComment("Former Employee", "Old note", Instant.parse("2024-01-03T14:05:00Z"))));
        when(destination.createComment(argThat(c -> c != null && c.userId() == 8)))
                .thenThrow(RemoteApiException.rejected("comments/modify", "nope"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), withComments));

        assertThat(outcome.tasksSucceeded()).isEqualTo(1);
        verify(destination, times(2)).createComment(commentCaptor.capture());
        CommentDraft attributed = commentCaptor.getAllValues().get(1);
        assertThat(attributed.userId()).isEqualTo(FALLBACK_USER);
        assertThat(attributed.text()).isEqualTo("[Former Employee - 2024-01-03 14:05]: Old note");
        assertThat(attributed.taskId()).isEqualTo(1000);
        assertThat(ctx.summary().getCommentFailures()).isEqualTo(1);
    }

    @Test
    void companyCreateRejectionLeavesProjectWithoutCompany() {
        when(destination.listCompanies()).thenReturn(List.of());
        when(destination.createCompany("Acme")).thenThrow(RemoteApiException.rejected("companies/modify", "response carried no id"));

        ProjectOutcome outcome = orchestrator.importProject(ctx, project(List.of(), task("t1", "One", "SEO", null, "Jane Doe")));

        assertThat(outcome.finalState()).isEqualTo(ImportState.DONE);
        ArgumentCaptor<ProjectDraft> draft = ArgumentCaptor.forClass(ProjectDraft.class);
        verify(destination).createProject(draft.capture());
        assertThat(draft.getValue().companyId()).isNull();
        assertThat(outcome.tasksSucceeded()).isEqualTo(1);
    }

    @Test
    void unavailableUserListingDoesNotFailTaskWithComments() {
        when(destination.listUsers()).thenThrow(RemoteApiException.httpStatus("users/list", 503, "unavailable"));
        TransformedTask unassigned = new TransformedTask("t1", "One", null, "SEO", null, List.of(), null,
                false, null, null, null, 2, null, null, List.of(
                new SourceComment("Sam Lee", "Looks good", Instant.parse("2024-01-02T09:30:00Z"))));
        TransformedProject noManager = new TransformedProject("src-1", "Acme", null, ProjectClassification.CLIENT,
                "Acme", null, null, List.of(), List.of(unassigned));

        ProjectOutcome outcome = orchestrator.importProject(ctx, noManager);

        assertThat(outcome.tasksSucceeded()).isEqualTo(1);
        assertThat(outcome.tasksFailed()).isZero();
        verify(destination).createTask(any());
        verify(destination).createComment(commentCaptor.capture());
        assertThat(commentCaptor.getValue().userId()).isEqualTo(FALLBACK_USER);
        assertThat(commentCaptor.getValue().text()).isEqualTo("[Sam Lee - 2024-01-02 09:30]: Looks good");
        assertThat(ctx.summary().getCommentFailures()).isZero();
    }

    private TransformedProject project(List<PhaseSpec> phases, TransformedTask... tasks) {
        return new TransformedProject("src-1", "Acme", null, ProjectClassification.CLIENT, "Acme", "Sam Lee",
                null, phases, List.of(tasks));
    }

    private TransformedTask task(String id, String name, String activity, String phase, String assignee) {
        return new TransformedTask(id, name, null, activity, phase, List.of(assignee), assignee,
                false, null, null, null, 2, null, null, List.of());
    }
}
