package com.opentext.streaming.exception;

import lombok.Getter;

/**
 * A producer kept writing past the configured hard cap on buffered bytes.
 */
@Getter
public class BackpressureOverrunException extends StreamException {

    private final long bufferedBytes;
    private final long limit;

    public BackpressureOverrunException(long bufferedBytes, long limit) {
        super("Buffered size " + bufferedBytes + " would exceed hard limit " + limit);
        this.bufferedBytes = bufferedBytes;
        this.limit = limit;
    }
}
