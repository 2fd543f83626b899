package io.github.drompincen.taskbridge.runtime.retry;

import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;

import java.time.Duration;

/**
 * Observes what the executor does. All methods default to no-ops.
 */
public interface RetryListener {

    RetryListener NONE = new RetryListener() { };

    default void onAttempt(String operation, int attempt) { }

    default void onRetry(String operation, int attempt, Duration delay, RemoteApiException cause) { }

    default void onPacing(String operation, Duration delay) { }

    default void onSuccess(String operation, int attempts) { }

    default void onGiveUp(String operation, int attempts, RemoteApiException cause) { }
}
