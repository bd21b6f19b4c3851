package com.purchasingpower.bookflow.client;

import io.netty.handler.timeout.ReadTimeoutException;
import lombok.Getter;

import java.util.concurrent.TimeoutException;

/**
 * Raised by {@link LLMProvider} implementations on network or configuration problems.
 */
@Getter
public class LLMProviderException extends RuntimeException {

    private final FailureKind kind;

    public LLMProviderException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LLMProviderException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Classify a transport exception: anything with a timeout in its cause chain
     * is a timeout, everything else means the backend is unavailable.
     */
    public static LLMProviderException from(String providerName, Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof ReadTimeoutException) {
                return new LLMProviderException(FailureKind.TIMEOUT,
                        providerName + " timed out: " + error.getMessage(), error);
            }
            current = current.getCause();
        }
        return new LLMProviderException(FailureKind.UNAVAILABLE,
                providerName + " call failed: " + error.getMessage(), error);
    }
}
