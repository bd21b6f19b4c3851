package com.purchasingpower.bookflow.client;

import java.util.Optional;

/**
 * Outcome of a call to an external provider (generative text or vectors).
 *
 * <p>Callers branch on {@link #isSuccess()} instead of catching exceptions, so
 * every fallback is a visible code path.
 *
 * @param <T> type of the produced value
 */
public interface ProviderResult<T> {

    boolean isSuccess();

    /**
     * The produced value, empty on failure.
     */
    Optional<T> getValue();

    /**
     * Failure classification, null on success.
     */
    FailureKind getFailureKind();

    /**
     * Diagnostic message, null on success.
     */
    String getMessage();

    default T orElse(T fallback) {
        return getValue().orElse(fallback);
    }

    static <T> ProviderResult<T> success(T value) {
        return new ProviderResultImpl<>(true, value, null, null);
    }

    static <T> ProviderResult<T> failure(FailureKind kind, String message) {
        return new ProviderResultImpl<>(false, null, kind, message);
    }
}

record ProviderResultImpl<T>(
    boolean isSuccess,
    T value,
    FailureKind failureKind,
    String message
) implements ProviderResult<T> {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public FailureKind getFailureKind() {
        return failureKind;
    }

    @Override
    public String getMessage() {
        return message;
    }
}
