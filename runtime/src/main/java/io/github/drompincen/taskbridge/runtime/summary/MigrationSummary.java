package io.github.drompincen.taskbridge.runtime.summary;

import io.github.drompincen.taskbridge.protocol.api.ImportFailure;
import io.github.drompincen.taskbridge.protocol.api.ImportState;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.protocol.api.ProjectOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Run-wide counters and failure descriptors. Accumulates across all projects and is the
 * final output of a run.
 */
public class MigrationSummary {

    private final Instant startedAt;
    private Instant finishedAt;

    private int attempted;
    private int succeeded;
    private int failed;
    private int deduplicatedClient;
    private int deduplicatedTeam;
    private int excluded;
    private int phaseFailures;
    private int commentFailures;
    private int fallbackRetries;

    private final List<ImportFailure> failures = new ArrayList<>();
    private final List<ProjectOutcome> projects = new ArrayList<>();

    public MigrationSummary(Instant startedAt) {
        this.startedAt = startedAt;
    }

    // ---- recording ----

    public void recordAttempt() {
        attempted++;
    }

    public void recordSuccess() {
        succeeded++;
    }

    public void recordTaskFailure(ImportFailure failure) {
        failed++;
        failures.add(failure);
    }

    public void recordProjectFailure(ImportFailure failure) {
        failures.add(failure);
    }

    public void recordDeduplicated(ProjectClassification losingClassification, int count) {
        if (losingClassification == ProjectClassification.CLIENT) {
            deduplicatedClient += count;
        } else {
            deduplicatedTeam += count;
        }
    }

    public void recordExcluded() {
        excluded++;
    }

    public void recordPhaseFailures(int count) {
        phaseFailures += count;
    }

    public void recordCommentFailure() {
        commentFailures++;
    }

    public void recordFallbackRetry() {
        fallbackRetries++;
    }

    public void recordProject(ProjectOutcome outcome) {
        projects.add(outcome);
    }

    public void finish(Instant at) {
        this.finishedAt = at;
    }

    // ---- reporting ----

    public String report() {
        StringBuilder sb = new StringBuilder();
        sb.append("==================== MIGRATION SUMMARY ====================\n");
        sb.append(String.format("Projects: %d (%d done, %d failed)%n",
                projects.size(), countProjects(ImportState.DONE), countProjects(ImportState.FAILED)));
        sb.append(String.format("Tasks: %d attempted, %d succeeded, %d failed%n", attempted, succeeded, failed));
        sb.append(String.format("Deduplicated: %d client, %d team-member; excluded by cutoff: %d%n",
                deduplicatedClient, deduplicatedTeam, excluded));
        sb.append(String.format("Phase failures: %d, comment failures: %d, fallback-user retries: %d%n",
                phaseFailures, commentFailures, fallbackRetries));
        if (finishedAt != null) {
            sb.append(String.format("Duration: %d s%n", getDuration().toSeconds()));
        }
        for (ProjectOutcome p : projects) {
            sb.append(String.format("  [%s] %s (%s) -> %s, %d ok / %d failed%n",
                    p.finalState(), p.projectName(), p.classification(),
                    p.destinationProjectId() == null ? "-" : p.destinationProjectId(),
                    p.tasksSucceeded(), p.tasksFailed()));
        }
        if (!failures.isEmpty()) {
            sb.append("Failures:\n");
            for (ImportFailure f : failures) {
                if (f.isProjectFailure()) {
                    sb.append(String.format("  %s %s: %s%n", f.stage(), f.projectName(), f.message()));
                } else {
                    sb.append(String.format("  %s %s / %s (%s): %s%n",
                            f.stage(), f.projectName(), f.taskName(), f.taskId(), f.message()));
                }
            }
        }
        sb.append("===========================================================");
        return sb.toString();
    }

    private long countProjects(ImportState state) {
        return projects.stream().filter(p -> p.finalState() == state).count();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt == null ? startedAt : finishedAt);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public int getAttempted() {
        return attempted;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getFailed() {
        return failed;
    }

    public int getDeduplicatedClient() {
        return deduplicatedClient;
    }

    public int getDeduplicatedTeam() {
        return deduplicatedTeam;
    }

    public int getExcluded() {
        return excluded;
    }

    public int getPhaseFailures() {
        return phaseFailures;
    }

    public int getCommentFailures() {
        return commentFailures;
    }

    public int getFallbackRetries() {
        return fallbackRetries;
    }

    public List<ImportFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public List<ProjectOutcome> getProjects() {
        return Collections.unmodifiableList(projects);
    }
}
