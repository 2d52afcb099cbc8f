package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkTransformer;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Streaming run-length decoder. The input is a sequence of groups, each a letter with an optional
 * repeat count ("B3" is "BBB", a bare "B" is one "B"). Groups and counts may straddle chunk
 * boundaries, so a group is only expanded once the following letter or the end of input shows that
 * its count is complete.
 * <p>
 * Each call yields at most one chunk of {@code maxOutputChunk} bytes. The rest of a long run, and any
 * input not yet read, is kept and handed out through {@link #moreOutput()}, so "A2000000000" never
 * sits in memory as a whole.
 * </p>
 * Malformed input (a digit before the first letter, any other character, a zero count or one above
 * {@code Integer.MAX_VALUE}) fails with IllegalArgumentException.
 */
@Slf4j
public class RleDecoder implements ChunkTransformer {

    public static final int DEFAULT_MAX_OUTPUT_CHUNK = 8192;

    private final int maxOutputChunk;

    /** Letter of the group being read, or -1 when none. */
    private int current = -1;
    private long count;
    private boolean counted;

    /** Run being written out. */
    private int repeated;
    private long remaining;

    private byte[] input = new byte[0];
    private int position;
    private boolean ending;

    public RleDecoder() {
        this(DEFAULT_MAX_OUTPUT_CHUNK);
    }

    public RleDecoder(int maxOutputChunk) {
        if (maxOutputChunk <= 0) {
            throw new IllegalArgumentException("maxOutputChunk must be > 0, got: " + maxOutputChunk);
        }
        this.maxOutputChunk = maxOutputChunk;
    }

    @Override
    public CompletionStage<List<Chunk>> transform(Chunk chunk) {
        if (hasMoreOutput()) {
            throw new IllegalStateException("Output of the previous chunk was not collected");
        }
        input = chunk.toByteArray();
        position = 0;
        return CompletableFuture.completedFuture(produce());
    }

    @Override
    public CompletionStage<List<Chunk>> flush() {
        ending = true;
        return CompletableFuture.completedFuture(produce());
    }

    @Override
    public boolean hasMoreOutput() {
        return remaining > 0 || position < input.length || (ending && current >= 0);
    }

    @Override
    public List<Chunk> moreOutput() {
        return produce();
    }

    private List<Chunk> produce() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxOutputChunk, 1024));
        while (out.size() < maxOutputChunk) {
            if (remaining > 0) {
                int n = (int) Math.min(remaining, maxOutputChunk - out.size());
                for (int i = 0; i < n; i++) {
                    out.write(repeated);
                }
                remaining -= n;
            } else if (position < input.length) {
                read((char) (input[position++] & 0xff));
            } else if (ending && current >= 0) {
                startRun();
            } else {
                break;
            }
        }
        return out.size() == 0 ? List.of() : List.of(Chunk.of(out.toByteArray()));
    }

    private void read(char c) {
        if (Character.isDigit(c) && current >= 0) {
            count = count * 10 + (c - '0');
            counted = true;
            if (count > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Count of '" + (char) current + "' exceeds maximum: " + count);
            }
        } else if (Character.isLetter(c)) {
            startRun();
            current = c;
        } else if (current < 0) {
            throw new IllegalArgumentException("Expected letter, got: " + c);
        } else {
            throw new IllegalArgumentException("Expected letter or digit, got: " + c);
        }
    }

    /** Turn the completed group into the run to write out. */
    private void startRun() {
        if (current < 0) {
            return;
        }
        if (counted && count == 0) {
            throw new IllegalArgumentException("Count of '" + (char) current + "' must be positive");
        }
        repeated = current;
        remaining = counted ? count : 1;
        if (log.isDebugEnabled()) {
            log.debug("Expanding group: char={}, count={}", (char) repeated, remaining);
        }
        current = -1;
        count = 0;
        counted = false;
    }
}
