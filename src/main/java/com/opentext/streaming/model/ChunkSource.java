package com.opentext.streaming.model;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * External producer of chunks consumed by a readable stream.
 * <p>
 * {@link #nextChunk()} is only called when the readable has room in its buffer, and never while a
 * previous call is still outstanding. Implementations may complete synchronously.
 * </p>
 */
public interface ChunkSource extends AutoCloseable {

    /**
     * Produce the next chunk.
     *
     * @return a stage completing with the chunk, with an empty Optional at end of data, or
     * exceptionally when the source failed
     */
    CompletionStage<Optional<Chunk>> nextChunk();

    /** Release underlying resources. Called once when the readable ends, errors or is destroyed. */
    @Override
    default void close() {
    }
}
