package com.opentext.streaming.repository;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Collects every accepted chunk in memory.
 */
@Slf4j
public class InMemoryChunkSink implements ChunkSink {

    private final List<Chunk> chunks = new ArrayList<>();
    private volatile boolean finished;
    private volatile boolean aborted;
    private volatile Throwable abortCause;

    @Override
    public synchronized CompletionStage<Void> accept(Chunk chunk) {
        chunks.add(chunk);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletionStage<Void> finish() {
        finished = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void abort(Throwable cause) {
        aborted = true;
        abortCause = cause;
        log.debug("Sink aborted after {} chunk(s)", getChunks().size());
    }

    public synchronized List<Chunk> getChunks() {
        return List.copyOf(chunks);
    }

    public synchronized byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Chunk chunk : chunks) {
            if (!chunk.isObject()) {
                out.writeBytes(chunk.toByteArray());
            }
        }
        return out.toByteArray();
    }

    public String asString() {
        return new String(toByteArray(), StandardCharsets.UTF_8);
    }

    /** @return the payload of each byte chunk as UTF-8 text */
    public synchronized List<String> asStrings() {
        List<String> texts = new ArrayList<>();
        for (Chunk chunk : chunks) {
            texts.add(chunk.isObject() ? String.valueOf(chunk.value()) : chunk.asString());
        }
        return texts;
    }

    public boolean isFinished() {
        return finished;
    }

    public boolean isAborted() {
        return aborted;
    }

    public Throwable getAbortCause() {
        return abortCause;
    }
}
