package com.impetus.impetus_backend.service;

/**
 * Outcome of an editing operation. A rejected edit made no change; {@code reason} says why.
 */
public record EditResult<T>(boolean accepted, T value, String reason) {

    public static <T> EditResult<T> ok(T value) {
        return new EditResult<>(true, value, null);
    }

    public static <T> EditResult<T> rejected(String reason) {
        return new EditResult<>(false, null, reason);
    }

    public boolean isRejected() {
        return !accepted;
    }
}
