package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RleDecoderTest {

    private static List<Chunk> decodeChunks(RleDecoder decoder, String... chunks) {
        List<Chunk> out = new ArrayList<>();
        for (String chunk : chunks) {
            out.addAll(decoder.transform(Chunk.of(chunk)).toCompletableFuture().join());
            collectRest(decoder, out);
        }
        out.addAll(decoder.flush().toCompletableFuture().join());
        collectRest(decoder, out);
        return out;
    }

    private static void collectRest(RleDecoder decoder, List<Chunk> out) {
        while (decoder.hasMoreOutput()) {
            out.addAll(decoder.moreOutput());
        }
    }

    private static String decode(String... chunks) {
        StringBuilder out = new StringBuilder();
        decodeChunks(new RleDecoder(), chunks).forEach(c -> out.append(c.asString()));
        return out.toString();
    }

    @Test
    void testDecompress() {
        assertEquals("AAabBBBCccDDdddDDEEE", decode("A2abB3Cc2D2d3D2E3"));
    }

    @Test
    void testSingleAndPlainLetters() {
        assertEquals("A", decode("A"));
        assertEquals("ABC", decode("ABC"));
        assertEquals("Aabc", decode("Aabc"));
        assertEquals("ABCDE", decode("ABCDE"));
    }

    @Test
    void testCounts() {
        assertEquals("AAAAAAAAAA", decode("A10"));
        assertEquals("AAAAAAAAA", decode("A9"));
        assertEquals("A".repeat(1000), decode("A1000"));
        assertEquals("A".repeat(10) + "b".repeat(20) + "C".repeat(30), decode("A10b20C30"));
    }

    @Test
    void testEmpty() {
        assertEquals("", decode(""));
    }

    @Test
    void testCountSplitAcrossChunks() {
        assertEquals("A".repeat(12) + "B", decode("A1", "2B"));
        assertEquals("A".repeat(100), decode("A", "1", "00"));
    }

    @Test
    void testOutputIsCutIntoBoundedChunks() {
        List<Chunk> chunks = decodeChunks(new RleDecoder(4), "A10B");
        assertEquals(List.of("AAAA", "AAAA", "AA", "B"), chunks.stream().map(Chunk::asString).toList());
    }

    @Test
    void testLargeCountIsExpandedOnDemand() {
        RleDecoder decoder = new RleDecoder(1024);
        List<Chunk> first = decoder.transform(Chunk.of("A2000000000")).toCompletableFuture().join();
        assertEquals(1, first.size());
        assertEquals(1024, first.get(0).length());
        assertTrue(decoder.hasMoreOutput());

        for (int i = 0; i < 3; i++) {
            List<Chunk> next = decoder.moreOutput();
            assertEquals(1, next.size());
            assertEquals("A".repeat(1024), next.get(0).asString());
        }
        assertTrue(decoder.hasMoreOutput());
    }

    @Test
    void testTransformBeforeOutputCollectedIsRejected() {
        RleDecoder decoder = new RleDecoder(4);
        decoder.transform(Chunk.of("A10B"));
        assertTrue(decoder.hasMoreOutput());
        assertThrows(IllegalStateException.class, () -> decoder.transform(Chunk.of("C")));
    }

    @Test
    void testInvalidCharacter() {
        assertThrows(IllegalArgumentException.class, () -> decode("A2#B"));
    }

    @Test
    void testLeadingDigits() {
        assertThrows(IllegalArgumentException.class, () -> decode("123A2"));
    }

    @Test
    void testCountOverflow() {
        assertThrows(IllegalArgumentException.class, () -> decode("A2147483648"));
        assertThrows(IllegalArgumentException.class, () -> decode("A99999999999999999999"));
    }

    @Test
    void testZeroCount() {
        assertThrows(IllegalArgumentException.class, () -> decode("A0"));
    }

    @Test
    void testNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> decode("A-1"));
    }

    @Test
    void testRejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new RleDecoder(0));
    }
}
