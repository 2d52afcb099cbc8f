package com.opentext.streaming.model;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChunkTest {

    @Test
    void testOfCopiesBytes() {
        byte[] bytes = "abc".getBytes(StandardCharsets.UTF_8);
        Chunk chunk = Chunk.of(bytes);
        bytes[0] = 'x';
        assertEquals("abc", chunk.asString());
        assertEquals(3, chunk.length());
        assertFalse(chunk.isObject());
    }

    @Test
    void testOfRange() {
        Chunk chunk = Chunk.of("hello world".getBytes(StandardCharsets.UTF_8), 6, 5);
        assertEquals("world", chunk.asString());
        assertThrows(IndexOutOfBoundsException.class, () -> Chunk.of(new byte[3], 2, 2));
    }

    @Test
    void testEmptyChunkIsData() {
        Chunk empty = Chunk.empty();
        assertEquals(0, empty.length());
        assertFalse(empty.isObject());
        assertEquals("", empty.asString());
        assertEquals(empty, Chunk.of(new byte[0]));
    }

    @Test
    void testObjectChunk() {
        Chunk chunk = Chunk.ofObject(42);
        assertTrue(chunk.isObject());
        assertEquals(0, chunk.length());
        assertEquals(42, chunk.value(Integer.class));
        assertThrows(IllegalStateException.class, chunk::toByteArray);
        assertThrows(IllegalStateException.class, chunk::asString);
        assertThrows(NullPointerException.class, () -> Chunk.ofObject(null));
    }

    @Test
    void testSlice() {
        Chunk chunk = Chunk.of("abcdef");
        assertEquals("cd", chunk.slice(2, 4).asString());
        assertEquals(0, chunk.slice(3, 3).length());
        assertThrows(IndexOutOfBoundsException.class, () -> chunk.slice(4, 7));
    }

    @Test
    void testByteBufferIsReadOnly() {
        ByteBuffer buffer = Chunk.of("abc").asByteBuffer();
        assertEquals(3, buffer.remaining());
        assertThrows(ReadOnlyBufferException.class, () -> buffer.put((byte) 'x'));
    }

    @Test
    void testEqualityByContent() {
        assertEquals(Chunk.of("abc"), Chunk.of("abc".getBytes(StandardCharsets.UTF_8)));
        assertNotEquals(Chunk.of("abc"), Chunk.of("abd"));
        assertEquals(Chunk.ofObject("x"), Chunk.ofObject("x"));
    }

    @Test
    void testCharset() {
        Chunk chunk = Chunk.of("é", StandardCharsets.ISO_8859_1);
        assertEquals(1, chunk.length());
        assertEquals("é", chunk.asString(StandardCharsets.ISO_8859_1));
        assertEquals(2, Chunk.of("é").length());
    }
}
