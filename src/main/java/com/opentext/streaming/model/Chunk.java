package com.opentext.streaming.model;

import lombok.EqualsAndHashCode;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable unit of data moving through a stream.
 * <p>
 * A chunk either carries bytes (copied on creation, so the caller may reuse its array) or, for
 * object-mode streams, an opaque value. A zero-length chunk is a legal data chunk and never means
 * end of stream; end is always signalled explicitly.
 * </p>
 */
@EqualsAndHashCode
public final class Chunk {

    private static final byte[] NO_BYTES = new byte[0];

    /** Null for object chunks. */
    private final byte[] bytes;
    /** Null for byte chunks. */
    private final Object value;

    private Chunk(byte[] bytes, Object value) {
        this.bytes = bytes;
        this.value = value;
    }

    public static Chunk of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Chunk(bytes.length == 0 ? NO_BYTES : bytes.clone(), null);
    }

    public static Chunk of(byte[] bytes, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return new Chunk(length == 0 ? NO_BYTES : Arrays.copyOfRange(bytes, offset, offset + length), null);
    }

    public static Chunk of(String text) {
        return of(text, StandardCharsets.UTF_8);
    }

    public static Chunk of(String text, Charset charset) {
        return new Chunk(text.getBytes(charset), null);
    }

    public static Chunk empty() {
        return new Chunk(NO_BYTES, null);
    }

    /** Wrap an arbitrary value for object-mode streams. */
    public static Chunk ofObject(Object value) {
        return new Chunk(null, Objects.requireNonNull(value, "value"));
    }

    public boolean isObject() {
        return bytes == null;
    }

    /** @return byte length of the payload; zero for object chunks */
    public int length() {
        return bytes == null ? 0 : bytes.length;
    }

    /** @return a copy of the payload bytes */
    public byte[] toByteArray() {
        requireBytes();
        return bytes.clone();
    }

    /** @return a read-only view over the payload bytes */
    public ByteBuffer asByteBuffer() {
        requireBytes();
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    public String asString() {
        return asString(StandardCharsets.UTF_8);
    }

    public String asString(Charset charset) {
        requireBytes();
        return new String(bytes, charset);
    }

    public Object value() {
        return value;
    }

    public <T> T value(Class<T> type) {
        return type.cast(value);
    }

    /**
     * Return the bytes in {@code [from, to)} as a new chunk.
     */
    public Chunk slice(int from, int to) {
        requireBytes();
        Objects.checkFromToIndex(from, to, bytes.length);
        return new Chunk(Arrays.copyOfRange(bytes, from, to), null);
    }

    private void requireBytes() {
        if (bytes == null) {
            throw new IllegalStateException("Object chunk has no byte payload");
        }
    }

    @Override
    public String toString() {
        return isObject() ? "Chunk[object " + value + "]" : "Chunk[" + bytes.length + " bytes]";
    }
}
