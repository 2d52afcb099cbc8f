package com.opentext.streaming.buffer;

import com.opentext.streaming.exception.BackpressureOverrunException;
import com.opentext.streaming.model.Chunk;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of pending chunks with size accounting.
 * <p>
 * {@code bufferedBytes()} is always the sum of the sizes of the queued chunks, where a chunk's size
 * is its byte length, or 1 in object mode. The high-water mark is a threshold, not a capacity:
 * enqueue beyond it succeeds unless a hard limit was configured.
 * </p>
 * Not thread-safe; the owning stream guards every call.
 */
public class ChunkBuffer {

    private final Deque<Chunk> chunks = new ArrayDeque<>();
    private final long highWaterMark;
    private final boolean objectMode;
    /** Zero disables the hard limit. */
    private final long maxBufferedBytes;
    private long bufferedBytes;

    public ChunkBuffer(long highWaterMark, boolean objectMode, long maxBufferedBytes) {
        if (highWaterMark < 0) {
            throw new IllegalArgumentException("highWaterMark must be >= 0, got: " + highWaterMark);
        }
        if (maxBufferedBytes < 0) {
            throw new IllegalArgumentException("maxBufferedBytes must be >= 0, got: " + maxBufferedBytes);
        }
        this.highWaterMark = highWaterMark;
        this.objectMode = objectMode;
        this.maxBufferedBytes = maxBufferedBytes;
    }

    public ChunkBuffer(long highWaterMark) {
        this(highWaterMark, false, 0);
    }

    /** Append at the tail. */
    public void enqueue(Chunk chunk) {
        long size = sizeOf(chunk);
        checkLimit(size);
        chunks.addLast(chunk);
        bufferedBytes += size;
    }

    /** Put a chunk back at the head. */
    public void unshift(Chunk chunk) {
        long size = sizeOf(chunk);
        checkLimit(size);
        chunks.addFirst(chunk);
        bufferedBytes += size;
    }

    /** @return the oldest chunk, or null when empty */
    public Chunk dequeue() {
        Chunk chunk = chunks.pollFirst();
        if (chunk != null) {
            bufferedBytes -= sizeOf(chunk);
        }
        return chunk;
    }

    /**
     * Dequeue at most {@code maxBytes} bytes. A longer head chunk is split: its first
     * {@code maxBytes} bytes are returned and the rest stays at the head. Object chunks are never split.
     */
    public Chunk dequeue(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0, got: " + maxBytes);
        }
        Chunk head = chunks.peekFirst();
        if (head == null || objectMode || head.isObject() || head.length() <= maxBytes) {
            return dequeue();
        }
        chunks.pollFirst();
        chunks.addFirst(head.slice(maxBytes, head.length()));
        bufferedBytes -= maxBytes;
        return head.slice(0, maxBytes);
    }

    public Chunk peek() {
        return chunks.peekFirst();
    }

    public long bufferedBytes() {
        return bufferedBytes;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public long highWaterMark() {
        return highWaterMark;
    }

    public boolean isAboveHighWaterMark() {
        return bufferedBytes >= highWaterMark;
    }

    /**
     * Drop every queued chunk.
     *
     * @return the number of chunks discarded
     */
    public int clear() {
        int discarded = chunks.size();
        chunks.clear();
        bufferedBytes = 0;
        return discarded;
    }

    private long sizeOf(Chunk chunk) {
        return objectMode ? 1 : chunk.length();
    }

    private void checkLimit(long size) {
        if (maxBufferedBytes > 0 && bufferedBytes + size > maxBufferedBytes) {
            throw new BackpressureOverrunException(bufferedBytes + size, maxBufferedBytes);
        }
    }
}
