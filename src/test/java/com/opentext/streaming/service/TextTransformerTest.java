package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextTransformerTest {

    private static String run(TextTransformer transformer, byte[]... chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            transformer.transform(Chunk.of(chunk)).toCompletableFuture().join().forEach(c -> out.writeBytes(c.toByteArray()));
        }
        transformer.flush().toCompletableFuture().join().forEach(c -> out.writeBytes(c.toByteArray()));
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testUpperCase() {
        assertEquals("HELLO WORLD", run(TextTransformer.upperCase(), bytes("hello "), bytes("world")));
    }

    @Test
    void testLowerCase() {
        assertEquals("mixed case", run(TextTransformer.lowerCase(), bytes("MiXeD "), bytes("CaSe")));
    }

    @Test
    void testMultiByteCharacterSplitAcrossChunks() {
        byte[] text = bytes("größe");
        // "ö" is two bytes in UTF-8; cut between them
        byte[] head = Arrays.copyOfRange(text, 0, 3);
        byte[] tail = Arrays.copyOfRange(text, 3, text.length);

        TextTransformer transformer = TextTransformer.upperCase();
        List<Chunk> first = transformer.transform(Chunk.of(head)).toCompletableFuture().join();
        assertEquals("GR", first.get(0).asString());
        assertEquals("ÖSSE", run(transformer, tail));
    }

    @Test
    void testIncompleteTrailingSequenceIsReplacedOnFlush() {
        byte[] text = bytes("é");
        String result = run(TextTransformer.upperCase(), new byte[]{'a', text[0]});
        assertTrue(result.startsWith("A"));
        assertEquals(2, result.length());
    }

    @Test
    void testOtherCharset() {
        TextTransformer transformer = TextTransformer.upperCase(StandardCharsets.ISO_8859_1);
        List<Chunk> out = transformer.transform(Chunk.of("café", StandardCharsets.ISO_8859_1)).toCompletableFuture().join();
        assertEquals("CAFÉ", out.get(0).asString(StandardCharsets.ISO_8859_1));
        assertEquals(4, out.get(0).length());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
