package com.opentext.streaming.model;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * External consumer of chunks fed by a writable stream.
 * <p>
 * Chunks are handed over strictly one at a time: {@link #accept(Chunk)} is not called again until
 * the stage returned by the previous call has completed normally.
 * </p>
 */
@FunctionalInterface
public interface ChunkSink {

    /**
     * Accept one chunk.
     *
     * @return a stage completing when the chunk is acknowledged, or exceptionally when rejected
     */
    CompletionStage<Void> accept(Chunk chunk);

    /**
     * Called once after the last chunk has been acknowledged and before the writable reports finish.
     */
    default CompletionStage<Void> finish() {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Called once when the writable errors or is destroyed; undelivered chunks have been discarded.
     *
     * @param cause the error, or null for a plain destroy
     */
    default void abort(Throwable cause) {
    }
}
