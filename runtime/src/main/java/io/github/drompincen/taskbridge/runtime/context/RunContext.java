package io.github.drompincen.taskbridge.runtime.context;

import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.runtime.dedup.DedupLedger;
import io.github.drompincen.taskbridge.runtime.resolve.ResolutionCache;
import io.github.drompincen.taskbridge.runtime.retry.RetryExecutor;
import io.github.drompincen.taskbridge.runtime.retry.RetryListener;
import io.github.drompincen.taskbridge.runtime.retry.RetryPolicy;
import io.github.drompincen.taskbridge.runtime.retry.Sleeper;
import io.github.drompincen.taskbridge.runtime.summary.MigrationSummary;

import java.time.Clock;
import java.util.UUID;

/**
 * State of one multi-project run: dedup ledger, resolution cache, pacing state and summary.
 * Created when a run starts and passed to every component call; nothing outlives it.
 */
public final class RunContext {

    private final String runId;
    private final Clock clock;
    private final DedupLedger ledger;
    private final ResolutionCache cache;
    private final RetryExecutor executor;
    private final MigrationSummary summary;

    private RunContext(String runId, Clock clock, RetryExecutor executor) {
        this.runId = runId;
        this.clock = clock;
        this.ledger = new DedupLedger();
        this.cache = new ResolutionCache();
        this.executor = executor;
        this.summary = new MigrationSummary(clock.instant());
    }

    public static RunContext start(RetryPolicy policy, Clock clock, Sleeper sleeper, RetryListener listener) {
        return new RunContext(UUID.randomUUID().toString(), clock,
                new RetryExecutor(policy, clock, sleeper, listener));
    }

    public static RunContext start(RetryPolicy policy, Clock clock, Sleeper sleeper) {
        return start(policy, clock, sleeper, RetryListener.NONE);
    }

    /** Copies the ledger's dedup counters into the summary and stamps the end time. Runs once. */
    public MigrationSummary finish() {
        if (summary.getFinishedAt() == null) {
            for (ProjectClassification c : ProjectClassification.values()) {
                summary.recordDeduplicated(c, ledger.deduplicatedCount(c));
            }
            summary.finish(clock.instant());
        }
        return summary;
    }

    public String runId() {
        return runId;
    }

    public Clock clock() {
        return clock;
    }

    public DedupLedger ledger() {
        return ledger;
    }

    public ResolutionCache cache() {
        return cache;
    }

    public RetryExecutor executor() {
        return executor;
    }

    public MigrationSummary summary() {
        return summary;
    }
}
