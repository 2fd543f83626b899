package io.github.drompincen.taskbridge.runtime.resolve;

import java.util.Optional;

/**
 * Outcome of a name lookup. {@link #NOT_FOUND} is cached like any other outcome.
 */
public record Resolution(Integer id) {

    public static final Resolution NOT_FOUND = new Resolution(null);

    public static Resolution of(int id) {
        return new Resolution(id);
    }

    public boolean isFound() {
        return id != null;
    }

    public Optional<Integer> asOptional() {
        return Optional.ofNullable(id);
    }

    public int orElse(int fallback) {
        return id != null ? id : fallback;
    }
}
