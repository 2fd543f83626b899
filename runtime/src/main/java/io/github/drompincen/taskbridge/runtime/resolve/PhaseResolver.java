package io.github.drompincen.taskbridge.runtime.resolve;

import io.github.drompincen.taskbridge.protocol.remote.RemotePhase;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a phase title within one destination project.
 *
 * <p>The phase listing ignores its project filter and returns phases of every project, and
 * linking a task to a foreign phase moves the task to that phase's project. Candidates are
 * therefore always filtered here to the requested project before matching.
 */
@Service
public class PhaseResolver {

    private static final Logger log = LoggerFactory.getLogger(PhaseResolver.class);

    private final DestinationApi destination;

    public PhaseResolver(DestinationApi destination) {
        this.destination = destination;
    }

    public Resolution resolve(RunContext ctx, int destinationProjectId, String title) {
        if (Names.isBlank(title)) {
            return Resolution.NOT_FOUND;
        }
        return ctx.cache().resolve(EntityKind.PHASE, scope(destinationProjectId), title, () -> {
            Optional<RemotePhase> match = match(phasesOf(ctx, destinationProjectId), title);
            if (match.isEmpty()) {
                log.warn("No phase '{}' in destination project {}", title, destinationProjectId);
                return Resolution.NOT_FOUND;
            }
            return Resolution.of(match.get().id());
        });
    }

    /** Phases that belong to the project, with phases of other projects removed. */
    public List<RemotePhase> phasesOf(RunContext ctx, int destinationProjectId) {
        return ctx.cache().listing(EntityKind.PHASE, scope(destinationProjectId), () -> {
            List<RemotePhase> listed = ctx.executor().execute("projectPhases/list",
                    () -> destination.listPhases(destinationProjectId));
            List<RemotePhase> scoped = listed.stream()
                    .filter(p -> p.belongsTo(destinationProjectId))
                    .toList();
            if (scoped.size() != listed.size()) {
                log.debug("Dropped {} phases of other projects from listing for project {}",
                        listed.size() - scoped.size(), destinationProjectId);
            }
            return scoped;
        });
    }

    /** Forgets phases and cached outcomes of a project, after phases were added to it. */
    public void invalidate(RunContext ctx, int destinationProjectId) {
        ctx.cache().invalidateScope(EntityKind.PHASE, scope(destinationProjectId));
    }

    static Optional<RemotePhase> match(List<RemotePhase> phases, String title) {
        String wanted = Names.unescape(title);
        Optional<RemotePhase> exact = phases.stream()
                .filter(p -> Names.unescape(p.title()).equals(wanted))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return phases.stream()
                .filter(p -> Names.unescape(p.title()).equalsIgnoreCase(wanted))
                .findFirst();
    }

    private static String scope(int destinationProjectId) {
        return String.valueOf(destinationProjectId);
    }
}
