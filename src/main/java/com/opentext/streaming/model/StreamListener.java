package com.opentext.streaming.model;

/**
 * Observer for stream lifecycle events. All methods default to no-ops so callers override only
 * what they need. Events of a single stream are delivered one at a time, in order.
 * <p>
 * Data chunks are not delivered here; see {@link DataListener}.
 * </p>
 */
public interface StreamListener {

    /** Readable side: data is available to {@code read()} in paused mode, or EOF was reached. */
    default void onReadable() {
    }

    /** Writable side: buffered bytes fell back below the high-water mark. */
    default void onDrain() {
    }

    /** Readable side: EOF was pushed and every buffered chunk was consumed. Fires once. */
    default void onEnd() {
    }

    /** Writable side: {@code end()} was called and every chunk reached the sink. Fires once. */
    default void onFinish() {
    }

    /** The stream failed; it is now permanently inert. Fires at most once. */
    default void onError(Throwable error) {
    }

    /** The stream released its resources. Fires once, after end/finish/error/destroy. */
    default void onClose() {
    }
}
