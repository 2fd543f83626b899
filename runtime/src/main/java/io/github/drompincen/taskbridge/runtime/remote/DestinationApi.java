package io.github.drompincen.taskbridge.runtime.remote;

import io.github.drompincen.taskbridge.protocol.api.CommentDraft;
import io.github.drompincen.taskbridge.protocol.api.NormalizedTask;
import io.github.drompincen.taskbridge.protocol.api.PhaseSpec;
import io.github.drompincen.taskbridge.protocol.api.ProjectDraft;
import io.github.drompincen.taskbridge.protocol.remote.RemoteActivity;
import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.protocol.remote.RemoteProject;
import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;

import java.util.List;

/**
 * Write surface of the destination system. Each method is a single remote call and reports
 * failures as {@link RemoteApiException}; pacing and retries are the caller's concern.
 */
public interface DestinationApi {

    /** Cheap authenticated call used before a run starts. */
    void verifyAccess();

    List<RemoteUser> listUsers();

    /**
     * Lists phases for a project. The remote ignores the project filter, so the result may
     * contain phases of other projects.
     */
    List<RemotePhase> listPhases(int projectId);

    List<RemoteCompany> listCompanies();

    RemoteCompany createCompany(String name);

    List<RemoteActivity> listActivities();

    List<RemoteProject> findProjects(String name);

    RemoteProject createProject(ProjectDraft draft);

    /**
     * Adds phases to a project. The remote replaces the whole phase list on modify, so the
     * phases already present must be sent along.
     */
    void addPhases(int projectId, List<RemotePhase> existing, List<PhaseSpec> additions);

    int createTask(NormalizedTask task);

    int createComment(CommentDraft comment);
}
