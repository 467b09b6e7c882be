package io.herald.core.engine;

public enum DispatchOutcome {
    SKIPPED,
    DELIVERED,
    FAILED
}
