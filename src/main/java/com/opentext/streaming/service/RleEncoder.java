package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkTransformer;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Run-length encoder over a chunked byte stream.
 * Emits each byte followed by its run length if > 1 (e.g., "AAAA" -> "A4").
 * Runs may span chunk boundaries; the last run is emitted by {@link #flush()}.
 * Handles empty input ("" -> ""), single bytes ("A" -> "A") and multi-digit counts ("AAAAAAAAAA" -> "A10").
 */
public class RleEncoder implements ChunkTransformer {

    /** Byte value of the pending run, or -1 when none. */
    private int current = -1;
    private long count;

    @Override
    public CompletionStage<List<Chunk>> transform(Chunk chunk) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte b : chunk.toByteArray()) {
            int value = b & 0xff;
            if (value == current) {
                count++;
            } else {
                writeRun(out);
                current = value;
                count = 1;
            }
        }
        return CompletableFuture.completedFuture(toChunks(out));
    }

    @Override
    public CompletionStage<List<Chunk>> flush() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeRun(out);
        current = -1;
        count = 0;
        return CompletableFuture.completedFuture(toChunks(out));
    }

    private void writeRun(ByteArrayOutputStream out) {
        if (current < 0) {
            return;
        }
        out.write(current);
        if (count > 1) {
            out.writeBytes(Long.toString(count).getBytes(StandardCharsets.US_ASCII));
        }
    }

    private static List<Chunk> toChunks(ByteArrayOutputStream out) {
        return out.size() == 0 ? List.of() : List.of(Chunk.of(out.toByteArray()));
    }
}
