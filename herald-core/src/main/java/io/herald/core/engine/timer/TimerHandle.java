package io.herald.core.engine.timer;

public interface TimerHandle {
    /**
     * Stops future firings. Idempotent; a callback already running is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
