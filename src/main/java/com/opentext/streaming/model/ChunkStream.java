package com.opentext.streaming.model;

import java.util.function.Consumer;

/**
 * Operations shared by every stream: listener registration and cancellation.
 */
public interface ChunkStream {

    /** @return a name used in log messages */
    String getName();

    Registration addListener(StreamListener listener);

    /** Destroy without an error: buffers are discarded and no further chunk is delivered. */
    void destroy();

    /**
     * Destroy with an error: the stream moves to its errored state, discards its buffer and
     * reports the error to {@code onError} listeners. A null cause behaves like {@link #destroy()}.
     */
    void destroy(Throwable cause);

    /** @return true once the stream errored or was destroyed */
    boolean isDestroyed();

    default Registration onError(Consumer<Throwable> handler) {
        return addListener(new StreamListener() {
            @Override
            public void onError(Throwable error) {
                handler.accept(error);
            }
        });
    }

    default Registration onClose(Runnable handler) {
        return addListener(new StreamListener() {
            @Override
            public void onClose() {
                handler.run();
            }
        });
    }
}
