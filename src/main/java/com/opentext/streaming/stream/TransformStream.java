package com.opentext.streaming.stream;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;
import com.opentext.streaming.model.ChunkTransformer;
import com.opentext.streaming.model.StreamOptions;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stage that feeds every written chunk through a {@link ChunkTransformer} and pushes the results
 * on its readable side.
 * <p>
 * The writable side delivers one chunk at a time, and a chunk is acknowledged only when its
 * transform completed and the readable side is back below its high-water mark. {@link #write(Chunk)}
 * also returns false while the readable side is saturated, so a slow downstream stage pushes back
 * on whoever writes into this one. Output the transformer holds back is collected only while the
 * readable side has room. When the writable side ends, {@link ChunkTransformer#flush()}
 * output is pushed followed by EOF.
 * </p>
 */
public class TransformStream extends AbstractDuplexStream {

    private static final AtomicLong IDS = new AtomicLong();

    /** A capacity wait is registered on the readable side. */
    private final AtomicBoolean watchingCapacity = new AtomicBoolean();

    public TransformStream(ChunkTransformer transformer) {
        this(transformer, StreamOptions.defaults());
    }

    public TransformStream(ChunkTransformer transformer, StreamOptions options) {
        this(transformer, options, options);
    }

    public TransformStream(ChunkTransformer transformer, StreamOptions writableOptions, StreamOptions readableOptions) {
        this(nameOf(writableOptions), transformer, writableOptions, readableOptions);
    }

    private TransformStream(String name, ChunkTransformer transformer,
                            StreamOptions writableOptions, StreamOptions readableOptions) {
        this(name, transformer, new ReadableStream(null, rename(readableOptions, name + ".out")), writableOptions);
    }

    private TransformStream(String name, ChunkTransformer transformer, ReadableStream output,
                            StreamOptions writableOptions) {
        super(name, output, new WritableStream(new TransformingSink(transformer, output),
                rename(writableOptions, name + ".in"), output::isAboveHighWaterMark));
    }

    private static String nameOf(StreamOptions options) {
        return options.getName() != null ? options.getName() : "transform-" + IDS.incrementAndGet();
    }

    @Override
    public boolean write(Chunk chunk) {
        boolean accepted = writable.write(chunk);
        if (!accepted && readable.isAboveHighWaterMark() && watchingCapacity.compareAndSet(false, true)) {
            readable.awaitCapacity().thenRun(() -> {
                watchingCapacity.set(false);
                writable.recheckDrain();
            });
        }
        return accepted;
    }

    /**
     * Sink of the writable side: runs the transformer and pushes its output.
     */
    private static final class TransformingSink implements ChunkSink {

        private final ChunkTransformer transformer;
        private final ReadableStream output;

        private TransformingSink(ChunkTransformer transformer, ReadableStream output) {
            this.transformer = Objects.requireNonNull(transformer, "transformer");
            this.output = output;
        }

        @Override
        public CompletionStage<Void> accept(Chunk chunk) {
            CompletionStage<List<Chunk>> transformed;
            try {
                transformed = transformer.transform(chunk);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            return transformed.thenCompose(this::pushAll);
        }

        @Override
        public CompletionStage<Void> finish() {
            CompletionStage<List<Chunk>> trailing;
            try {
                trailing = transformer.flush();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            return trailing.thenCompose(this::pushAll).thenRun(output::pushEof);
        }

        private CompletionStage<Void> pushAll(List<Chunk> chunks) {
            CompletableFuture<Void> done = new CompletableFuture<>();
            pushAll(chunks, done);
            return done;
        }

        /** Push, then collect held-back output for as long as the readable side has room. */
        private void pushAll(List<Chunk> chunks, CompletableFuture<Void> done) {
            List<Chunk> next = chunks;
            while (true) {
                try {
                    if (next != null) {
                        for (Chunk chunk : next) {
                            output.push(chunk);
                        }
                    }
                    CompletableFuture<Void> capacity = output.awaitCapacity();
                    if (!capacity.isDone()) {
                        capacity.whenComplete((ignored, error) -> {
                            if (error != null) {
                                done.completeExceptionally(error);
                            } else {
                                pushAll(null, done);
                            }
                        });
                        return;
                    }
                    if (!transformer.hasMoreOutput()) {
                        done.complete(null);
                        return;
                    }
                    next = transformer.moreOutput();
                } catch (RuntimeException e) {
                    done.completeExceptionally(e);
                    return;
                }
            }
        }
    }
}
