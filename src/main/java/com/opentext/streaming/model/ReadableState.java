package com.opentext.streaming.model;

/**
 * Lifecycle of the readable side: {@code IDLE -> FLOWING <-> PAUSED -> ENDED}.
 * ERRORED and DESTROYED are reachable from any non-terminal state and are absorbing.
 */
public enum ReadableState {
    /** No consumer attached yet. */
    IDLE,
    /** Chunks are handed to data listeners as soon as they are available. */
    FLOWING,
    /** Consumer must pull with {@code read()}. */
    PAUSED,
    /** EOF pushed and buffer fully drained. */
    ENDED,
    ERRORED,
    DESTROYED;

    /** @return true once no further chunk can be emitted */
    public boolean isTerminal() {
        return this == ENDED || this == ERRORED || this == DESTROYED;
    }
}
