package com.opentext.streaming.repository;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSource;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reads a file as fixed-size chunks; only the last chunk may be shorter.
 * The file is opened on the first request, so a stream that is never consumed holds no handle.
 */
@Slf4j
public class FileChunkSource implements ChunkSource {

    private final Path path;
    private final int chunkSize;
    private InputStream input;
    private boolean closed;

    public FileChunkSource(Path path, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got: " + chunkSize);
        }
        this.path = path;
        this.chunkSize = chunkSize;
    }

    @Override
    public CompletionStage<Optional<Chunk>> nextChunk() {
        try {
            if (closed) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            if (input == null) {
                input = new BufferedInputStream(Files.newInputStream(path), chunkSize);
                log.debug("Opened {} for reading", path);
            }
            byte[] bytes = new byte[chunkSize];
            int read = input.readNBytes(bytes, 0, chunkSize);
            if (read == 0) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return CompletableFuture.completedFuture(Optional.of(Chunk.of(bytes, 0, read)));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to read " + path, e));
        }
    }

    @Override
    public void close() {
        closed = true;
        if (input == null) {
            return;
        }
        try {
            input.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", path, e.getMessage());
        } finally {
            input = null;
        }
    }
}
