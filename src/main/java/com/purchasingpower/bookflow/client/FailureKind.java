package com.purchasingpower.bookflow.client;

/**
 * Why a provider call did not produce a usable value.
 */
public enum FailureKind {
    /** Backend unreachable or answered with an error status. */
    UNAVAILABLE,
    TIMEOUT,
    /** Backend answered, but the payload was empty or not what was asked for. */
    MALFORMED_OUTPUT,
    /** Provider selected without the settings it needs (missing API key, unknown name). */
    NOT_CONFIGURED
}
