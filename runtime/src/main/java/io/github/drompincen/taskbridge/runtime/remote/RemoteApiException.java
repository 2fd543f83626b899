package io.github.drompincen.taskbridge.runtime.remote;

import java.io.IOException;

/**
 * Failure of one outbound call. Transient failures (429, 5xx, network level) are retried by
 * {@link io.github.drompincen.taskbridge.runtime.retry.RetryExecutor}; everything else propagates at once.
 */
public class RemoteApiException extends RuntimeException {

    private final String operation;
    private final int statusCode;
    private final boolean transientFailure;

    public RemoteApiException(String operation, int statusCode, boolean transientFailure, String message, Throwable cause) {
        super(operation + " failed" + (statusCode > 0 ? " (HTTP " + statusCode + ")" : "") + ": " + message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public static RemoteApiException httpStatus(String operation, int statusCode, String message) {
        boolean retryable = statusCode == 429 || statusCode >= 500;
        return new RemoteApiException(operation, statusCode, retryable, message, null);
    }

    /** The remote answered but refused the request, e.g. a validation error in the response body. */
    public static RemoteApiException rejected(String operation, String message) {
        return new RemoteApiException(operation, 0, false, message, null);
    }

    public static RemoteApiException network(String operation, IOException cause) {
        return new RemoteApiException(operation, 0, true, String.valueOf(cause.getMessage()), cause);
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
