package com.opentext.streaming.model;

import java.util.concurrent.CompletableFuture;

/**
 * Contract of a writable stream.
 */
public interface Writable extends ChunkStream {

    /**
     * Queue a chunk for delivery to the sink. Never blocks.
     *
     * @return false once buffered size reached the high-water mark; callers must wait for drain
     * @throws com.opentext.streaming.exception.ProtocolViolationException after end or destroy
     */
    boolean write(Chunk chunk);

    /** Signal that no further writes will occur. */
    void end();

    default void end(Chunk last) {
        write(last);
        end();
    }

    /** @return true while {@link #write(Chunk)} is allowed */
    boolean isWritable();

    /** @return true between a {@code false} write and the matching drain */
    boolean needsDrain();

    WritableState getWritableState();

    long getWritableBufferedBytes();

    long getWritableHighWaterMark();

    /** @return a future completed on finish, failed on error, cancelled on destroy */
    CompletableFuture<Void> whenFinished();

    default Registration onDrain(Runnable handler) {
        return addListener(new StreamListener() {
            @Override
            public void onDrain() {
                handler.run();
            }
        });
    }

    default Registration onFinish(Runnable handler) {
        return addListener(new StreamListener() {
            @Override
            public void onFinish() {
                handler.run();
            }
        });
    }
}
