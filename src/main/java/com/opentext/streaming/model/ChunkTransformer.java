package com.opentext.streaming.model;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * User-supplied function of a transform stream. Each input chunk yields zero, one or many output
 * chunks. Calls are made one at a time: the next chunk is only passed in after the stage returned
 * for the previous one completed.
 * <p>
 * A transformer whose output can be far larger than its input returns a bounded part of it and
 * reports the rest through {@link #hasMoreOutput()}; the stream then collects it piece by piece with
 * {@link #moreOutput()}, each time its readable side has room again.
 * </p>
 */
@FunctionalInterface
public interface ChunkTransformer {

    CompletionStage<List<Chunk>> transform(Chunk chunk);

    /** Emit trailing output once the writable side ended. */
    default CompletionStage<List<Chunk>> flush() {
        return CompletableFuture.completedFuture(List.of());
    }

    default boolean hasMoreOutput() {
        return false;
    }

    /** Next part of the output held back by the last {@code transform}, {@code flush} or {@code moreOutput} call. */
    default List<Chunk> moreOutput() {
        return List.of();
    }

    static ChunkTransformer of(Function<Chunk, List<Chunk>> function) {
        return chunk -> CompletableFuture.completedFuture(function.apply(chunk));
    }

    static ChunkTransformer map(UnaryOperator<Chunk> mapper) {
        return chunk -> CompletableFuture.completedFuture(List.of(mapper.apply(chunk)));
    }
}
