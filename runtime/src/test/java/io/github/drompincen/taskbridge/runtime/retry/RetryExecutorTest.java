package io.github.drompincen.taskbridge.runtime.retry;

import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Duration> retryDelays = new ArrayList<>();
    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final RetryListener recorder = new RetryListener() {
        @Override
        public void onRetry(String operation, int attempt, Duration delay, RemoteApiException cause) {
            retryDelays.add(delay);
        }
    };

    @BeforeEach
    void setUp() {
        sleeps.clear();
        retryDelays.clear();
    }

    @Test
    void twoRateLimitsThenSuccessRetriesExactlyTwice() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), Duration.ZERO);
        RetryExecutor executor = new RetryExecutor(policy, clock, sleeps::add, recorder);
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("tasks/modify", () -> {
            if (calls.incrementAndGet() <= 2) {
                throw RemoteApiException.httpStatus("tasks/modify", 429, "Too Many Requests");
            }
            return "created";
        });

        assertThat(result).isEqualTo("created");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(executor.getTotalRetries()).isEqualTo(2);
        assertThat(retryDelays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void backoffIsCappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(4, Duration.ofSeconds(1), 10.0, Duration.ofSeconds(5), Duration.ZERO);
        RetryExecutor executor = new RetryExecutor(policy, clock, sleeps::add, recorder);

        assertThatThrownBy(() -> executor.execute("users/list", () -> {
            throw RemoteApiException.httpStatus("users/list", 503, "unavailable");
        })).isInstanceOf(RemoteApiException.class);

        assertThat(retryDelays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @Test
    void nonTransientFailurePropagatesWithoutRetry() {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), clock, sleeps::add, recorder);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("tasks/modify", () -> {
            calls.incrementAndGet();
            throw RemoteApiException.httpStatus("tasks/modify", 400, "bad request");
        })).isInstanceOf(RemoteApiException.class)
                .hasMessageContaining("HTTP 400");

        assertThat(calls.get()).isEqualTo(1);
        assertThat(retryDelays).isEmpty();
    }

    @Test
    void exhaustedRetriesRethrowLastFailure() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofSeconds(1), Duration.ZERO);
        RetryExecutor executor = new RetryExecutor(policy, clock, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("projects/list", () -> {
            throw RemoteApiException.httpStatus("projects/list", 500 + calls.incrementAndGet(), "boom");
        })).isInstanceOfSatisfying(RemoteApiException.class,
                e -> assertThat(e.getStatusCode()).isEqualTo(503));

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void consecutiveCallsArePacedByMinInterval() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), Duration.ofMillis(50));
        RetryExecutor executor = new RetryExecutor(policy, clock, sleeps::add);

        executor.execute("a", () -> 1);
        executor.execute("b", () -> 2);
        executor.execute("c", () -> 3);

        assertThat(sleeps).containsExactly(Duration.ofMillis(50), Duration.ofMillis(50));
        assertThat(executor.getTotalCalls()).isEqualTo(3);
    }

    @Test
    void interruptedSleepSurfacesAsNonTransientFailure() {
        RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults(), clock, d -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> executor.execute("tasks/modify", () -> {
            throw RemoteApiException.httpStatus("tasks/modify", 429, "slow down");
        })).isInstanceOfSatisfying(RemoteApiException.class, e -> assertThat(e.isTransient()).isFalse());

        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void policyRejectsInvalidValues() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
