package com.opentext.streaming.model;

import lombok.Builder;
import lombok.Value;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Construction-time configuration of a stream.
 * <p>
 * When {@code highWaterMark} is not set it defaults to {@value #DEFAULT_HIGH_WATER_MARK} bytes, or
 * {@value #DEFAULT_OBJECT_HIGH_WATER_MARK} chunks in object mode. Object-mode streams count one unit
 * per chunk instead of bytes. A positive {@code maxBufferedBytes} turns the advisory high-water
 * mark into a hard cap.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class StreamOptions {

    public static final long DEFAULT_HIGH_WATER_MARK = 16 * 1024;
    public static final long DEFAULT_OBJECT_HIGH_WATER_MARK = 16;

    Long highWaterMark;
    boolean objectMode;
    long maxBufferedBytes;
    /** Runs stream tasks; the common pool when unset. */
    Executor executor;
    String name;

    public static StreamOptions defaults() {
        return builder().build();
    }

    public static StreamOptions withHighWaterMark(long highWaterMark) {
        return builder().highWaterMark(highWaterMark).build();
    }

    public long effectiveHighWaterMark() {
        if (highWaterMark != null) {
            return highWaterMark;
        }
        return objectMode ? DEFAULT_OBJECT_HIGH_WATER_MARK : DEFAULT_HIGH_WATER_MARK;
    }

    public Executor effectiveExecutor() {
        return executor != null ? executor : ForkJoinPool.commonPool();
    }
}
