package com.opentext.streaming.service;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkTransformer;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.UnaryOperator;

/**
 * Applies a text mapping to a byte stream in a given charset.
 * A multi-byte character split across two chunks is held back until the rest of it arrives;
 * malformed input is replaced rather than rejected.
 */
public class TextTransformer implements ChunkTransformer {

    private final Charset charset;
    private final UnaryOperator<String> mapping;
    private final CharsetDecoder decoder;
    /** Undecoded tail of the previous chunk. */
    private byte[] leftover = new byte[0];

    public TextTransformer(Charset charset, UnaryOperator<String> mapping) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    public static TextTransformer upperCase() {
        return upperCase(StandardCharsets.UTF_8);
    }

    public static TextTransformer upperCase(Charset charset) {
        return new TextTransformer(charset, text -> text.toUpperCase(Locale.ROOT));
    }

    public static TextTransformer lowerCase() {
        return lowerCase(StandardCharsets.UTF_8);
    }

    public static TextTransformer lowerCase(Charset charset) {
        return new TextTransformer(charset, text -> text.toLowerCase(Locale.ROOT));
    }

    @Override
    public CompletionStage<List<Chunk>> transform(Chunk chunk) {
        ByteBuffer input = ByteBuffer.allocate(leftover.length + chunk.length());
        input.put(leftover).put(chunk.asByteBuffer()).flip();
        CharBuffer chars = CharBuffer.allocate(capacityFor(input.remaining()));
        decoder.decode(input, chars, false);
        leftover = new byte[input.remaining()];
        input.get(leftover);
        return CompletableFuture.completedFuture(emit(chars));
    }

    @Override
    public CompletionStage<List<Chunk>> flush() {
        ByteBuffer input = ByteBuffer.wrap(leftover);
        CharBuffer chars = CharBuffer.allocate(capacityFor(input.remaining()) + 1);
        decoder.decode(input, chars, true);
        decoder.flush(chars);
        decoder.reset();
        leftover = new byte[0];
        return CompletableFuture.completedFuture(emit(chars));
    }

    private int capacityFor(int bytes) {
        return (int) Math.ceil(bytes * (double) decoder.maxCharsPerByte()) + 1;
    }

    private List<Chunk> emit(CharBuffer chars) {
        chars.flip();
        if (!chars.hasRemaining()) {
            return List.of();
        }
        return List.of(Chunk.of(mapping.apply(chars.toString()), charset));
    }
}
