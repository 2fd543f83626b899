package io.github.drompincen.taskbridge.runtime.retry;

import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs outbound calls one at a time, spacing them by the policy's minimum interval and
 * retrying transient failures with capped exponential backoff.
 * Not thread-safe: one instance belongs to one run.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RetryListener listener;

    private Instant lastCallStartedAt;
    private long totalCalls;
    private long totalRetries;

    public RetryExecutor(RetryPolicy policy, Clock clock, Sleeper sleeper, RetryListener listener) {
        this.policy = policy;
        this.clock = clock;
        this.sleeper = sleeper;
        this.listener = listener == null ? RetryListener.NONE : listener;
    }

    public RetryExecutor(RetryPolicy policy, Clock clock, Sleeper sleeper) {
        this(policy, clock, sleeper, RetryListener.NONE);
    }

    public <T> T execute(String operation, RemoteCall<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            pace(operation);
            listener.onAttempt(operation, attempt);
            totalCalls++;
            try {
                T result = call.call();
                listener.onSuccess(operation, attempt);
                return result;
            } catch (RemoteApiException e) {
                if (!e.isTransient() || attempt >= policy.maxAttempts()) {
                    listener.onGiveUp(operation, attempt, e);
                    if (e.isTransient()) {
                        log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    }
                    throw e;
                }
                Duration delay = policy.delayBeforeRetry(attempt);
                listener.onRetry(operation, attempt, delay, e);
                totalRetries++;
                log.warn("{} attempt {}/{} failed ({}), retrying in {} ms",
                        operation, attempt, policy.maxAttempts(), e.getMessage(), delay.toMillis());
                sleep(operation, delay);
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getTotalRetries() {
        return totalRetries;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void pace(String operation) {
        if (lastCallStartedAt != null && !policy.minInterval().isZero()) {
            Duration elapsed = Duration.between(lastCallStartedAt, clock.instant());
            Duration wait = policy.minInterval().minus(elapsed);
            if (!wait.isNegative() && !wait.isZero()) {
                listener.onPacing(operation, wait);
                sleep(operation, wait);
            }
        }
        lastCallStartedAt = clock.instant();
    }

    private void sleep(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException(operation, 0, false, "interrupted while waiting", e);
        }
    }
}
