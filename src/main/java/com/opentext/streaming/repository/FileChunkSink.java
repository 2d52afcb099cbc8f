package com.opentext.streaming.repository;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Writes chunks to a temporary file and moves it over the target on finish, so readers never see
 * a partial file. Abort deletes the temporary file and leaves the target untouched.
 */
@Slf4j
public class FileChunkSink implements ChunkSink {

    private final Path target;
    private final Path tempPath;
    private final int bufferSize;
    private OutputStream output;

    public FileChunkSink(Path target, Path tempPath, int bufferSize) {
        this.target = target;
        this.tempPath = tempPath;
        this.bufferSize = Math.max(1024, bufferSize);
    }

    @Override
    public CompletionStage<Void> accept(Chunk chunk) {
        try {
            ensureOpen().write(chunk.toByteArray());
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to write " + tempPath, e));
        }
    }

    @Override
    public CompletionStage<Void> finish() {
        try {
            OutputStream out = ensureOpen();
            out.flush();
            out.close();
            output = null;
            moveIntoPlace();
            log.info("Saved {}", target);
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            log.error("Failed to save {}", target, e);
            deleteTemp();
            return CompletableFuture.failedFuture(new UncheckedIOException("Save failed for " + target, e));
        }
    }

    @Override
    public void abort(Throwable cause) {
        closeQuietly();
        deleteTemp();
        log.info("Aborted write of {}{}", target, cause == null ? "" : ": " + cause.getMessage());
    }

    private OutputStream ensureOpen() throws IOException {
        if (output == null) {
            output = new BufferedOutputStream(Files.newOutputStream(tempPath), bufferSize);
            log.debug("Writing {} through {}", target, tempPath);
        }
        return output;
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void closeQuietly() {
        if (output == null) {
            return;
        }
        try {
            output.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", tempPath, e.getMessage());
        } finally {
            output = null;
        }
    }

    private void deleteTemp() {
        try {
            if (Files.deleteIfExists(tempPath)) {
                log.debug("Cleaned up temp file: {}", tempPath);
            }
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", tempPath, e.getMessage());
        }
    }
}
