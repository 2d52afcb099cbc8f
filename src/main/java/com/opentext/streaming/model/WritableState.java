package com.opentext.streaming.model;

/**
 * Lifecycle of the writable side: {@code IDLE -> ACTIVE -> ENDING -> FINISHED}.
 * ERRORED and DESTROYED are absorbing.
 */
public enum WritableState {
    /** Nothing written yet. */
    IDLE,
    ACTIVE,
    /** {@code end()} called, buffer still draining to the sink. */
    ENDING,
    FINISHED,
    ERRORED,
    DESTROYED;

    public boolean isTerminal() {
        return this == FINISHED || this == ERRORED || this == DESTROYED;
    }

    /** @return true while {@code write()} is still allowed */
    public boolean acceptsWrites() {
        return this == IDLE || this == ACTIVE;
    }
}
