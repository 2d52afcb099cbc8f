package com.opentext.streaming.model;

import java.util.concurrent.CompletableFuture;

/**
 * Producer-facing and consumer-facing contract of a readable stream.
 */
public interface Readable extends ChunkStream {

    /**
     * Append a chunk to the internal buffer.
     *
     * @return false once buffered size reached the high-water mark; advisory only
     * @throws com.opentext.streaming.exception.ProtocolViolationException after EOF or destroy
     */
    boolean push(Chunk chunk);

    /** Signal that no more chunks will be pushed. */
    void pushEof();

    /** Put a chunk back at the head of the buffer. */
    void unshift(Chunk chunk);

    /** @return the next buffered chunk, or null when the buffer is currently empty */
    Chunk read();

    /**
     * Like {@link #read()} but never returns more than {@code maxBytes} bytes; a longer head chunk
     * is split and its remainder stays buffered.
     */
    Chunk read(int maxBytes);

    void pause();

    void resume();

    boolean isPaused();

    /**
     * Register a data consumer. The first registration switches an idle stream into flowing mode.
     */
    Registration onData(DataListener listener);

    ReadableState getReadableState();

    long getReadableBufferedBytes();

    long getReadableHighWaterMark();

    /** @return a future completed on end, failed on error, cancelled on destroy */
    CompletableFuture<Void> whenEnded();

    default Registration onEnd(Runnable handler) {
        return addListener(new StreamListener() {
            @Override
            public void onEnd() {
                handler.run();
            }
        });
    }

    default Registration onReadable(Runnable handler) {
        return addListener(new StreamListener() {
            @Override
            public void onReadable() {
                handler.run();
            }
        });
    }
}
