package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RleEncoderTest {

    /** Feed each string as one chunk, then flush. */
    private static String encode(String... chunks) {
        RleEncoder encoder = new RleEncoder();
        StringBuilder out = new StringBuilder();
        for (String chunk : chunks) {
            encoder.transform(Chunk.of(chunk)).toCompletableFuture().join().forEach(c -> out.append(c.asString()));
        }
        encoder.flush().toCompletableFuture().join().forEach(c -> out.append(c.asString()));
        return out.toString();
    }

    @Test
    void testCompress() {
        assertEquals("A2abB3Cc2D2d3D2E3", encode("AAabBBBCccDDdddDDEEE"));
    }

    @Test
    void testSingleCharacter() {
        assertEquals("A", encode("A"));
    }

    @Test
    void testMultiDigitCount() {
        assertEquals("A10", encode("AAAAAAAAAA"));
        assertEquals("A1000", encode("A".repeat(1000)));
        assertEquals("A10B11", encode("AAAAAAAAAABBBBBBBBBBB"));
    }

    @Test
    void testEmpty() {
        assertEquals("", encode(""));
        assertEquals("", encode());
    }

    @Test
    void testNoRuns() {
        assertEquals("ABC", encode("ABC"));
    }

    @Test
    void testRunsSpanChunkBoundaries() {
        assertEquals("A2abB3Cc2D2d3D2E3", encode("AAa", "bB", "BBCc", "cDDd", "", "ddDDE", "EE"));
        assertEquals("A10", encode("AAAA", "AAAAAA"));
    }

    @Test
    void testPendingRunIsHeldUntilNextByteOrFlush() {
        RleEncoder encoder = new RleEncoder();
        List<Chunk> first = encoder.transform(Chunk.of("AAA")).toCompletableFuture().join();
        assertTrue(first.isEmpty());
        List<Chunk> second = encoder.transform(Chunk.of("AB")).toCompletableFuture().join();
        assertEquals("A4", second.get(0).asString());
        assertEquals("B", encoder.flush().toCompletableFuture().join().get(0).asString());
        // flush resets state
        assertTrue(encoder.flush().toCompletableFuture().join().isEmpty());
    }
}
