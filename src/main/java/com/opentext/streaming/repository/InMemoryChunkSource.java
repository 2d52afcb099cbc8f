package com.opentext.streaming.repository;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves a fixed sequence of chunks, then end of data.
 */
public class InMemoryChunkSource implements ChunkSource {

    private final Iterator<Chunk> chunks;
    private final AtomicInteger requests = new AtomicInteger();
    private volatile boolean closed;

    public InMemoryChunkSource(Iterable<Chunk> chunks) {
        this.chunks = chunks.iterator();
    }

    public static InMemoryChunkSource of(String... texts) {
        return new InMemoryChunkSource(Arrays.stream(texts).map(Chunk::of).toList());
    }

    /** Split {@code text} into UTF-8 chunks of at most {@code chunkSize} bytes. */
    public static InMemoryChunkSource split(String text, int chunkSize) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        List<Chunk> chunks = new ArrayList<>();
        for (int offset = 0; offset < bytes.length; offset += chunkSize) {
            chunks.add(Chunk.of(bytes, offset, Math.min(chunkSize, bytes.length - offset)));
        }
        return new InMemoryChunkSource(chunks);
    }

    @Override
    public CompletionStage<Optional<Chunk>> nextChunk() {
        requests.incrementAndGet();
        if (closed || !chunks.hasNext()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.of(chunks.next()));
    }

    /** @return how many times {@link #nextChunk()} was called */
    public int getRequests() {
        return requests.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
