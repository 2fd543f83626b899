package io.github.drompincen.taskbridge.runtime.retry;

@FunctionalInterface
public interface RemoteCall<T> {

    T call();
}
