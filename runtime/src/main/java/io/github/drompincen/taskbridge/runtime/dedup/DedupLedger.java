package io.github.drompincen.taskbridge.runtime.dedup;

import io.github.drompincen.taskbridge.protocol.api.ClassifiedProject;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records which project owns each source task for the lifetime of a run. Entries are
 * written once and never replaced.
 *
 * <p>Client projects outrank team-member projects. Because entries are immutable, that rule
 * only holds if every client project is visited before any team-member project; callers plan
 * the visit order with {@link #priorityOrder(List)}, and {@link #reserve} rejects a client
 * candidate that arrives after a team-member project already claimed the task. Between two
 * projects of the same classification the first one visited wins.
 */
public class DedupLedger {

    private static final Logger log = LoggerFactory.getLogger(DedupLedger.class);

    private final Map<String, Entry> entries = new HashMap<>();
    private final Map<ProjectClassification, Integer> deduplicated = new EnumMap<>(ProjectClassification.class);

    /**
     * Claims {@code taskId} for a project. Re-claiming by the owning project is accepted.
     * <p>
     * Callers must visit projects in {@link #priorityOrder(List)} order: a client candidate
     * never arrives after a team-member project already holds the task.
     *
     * @throws IllegalStateException if a client project claims a task already held by a
     *                               team-member project, which means the visit order was wrong
     */
    public DedupDecision reserve(String taskId, String candidateProjectId, ProjectClassification candidate) {
        Entry existing = entries.get(taskId);
        if (existing == null) {
            entries.put(taskId, new Entry(candidateProjectId, candidate));
            return DedupDecision.ACCEPT;
        }
        if (existing.projectId().equals(candidateProjectId)) {
            return DedupDecision.ACCEPT;
        }
        if (candidate.outranks(existing.classification())) {
            throw new IllegalStateException("Task " + taskId + " was claimed by team-member project "
                    + existing.projectId() + " before client project " + candidateProjectId
                    + " was visited; projects must be visited in priority order");
        }
        deduplicated.merge(candidate, 1, Integer::sum);
        log.debug("Task {} already assigned to project {} ({}), skipping for {} ({})",
                taskId, existing.projectId(), existing.classification(), candidateProjectId, candidate);
        return DedupDecision.ALREADY_ASSIGNED_ELSEWHERE;
    }

    public Optional<Entry> winner(String taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    public int deduplicatedCount(ProjectClassification losingClassification) {
        return deduplicated.getOrDefault(losingClassification, 0);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Stable reordering that puts client projects first and keeps the requested order otherwise.
     */
    public static List<ClassifiedProject> priorityOrder(List<ClassifiedProject> projects) {
        return projects.stream()
                .sorted(Comparator.comparing((ClassifiedProject p) -> p.isClient() ? 0 : 1))
                .toList();
    }

    public record Entry(String projectId, ProjectClassification classification) {}
}
