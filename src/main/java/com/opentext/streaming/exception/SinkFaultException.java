package com.opentext.streaming.exception;

/**
 * The external chunk sink rejected or failed to accept a chunk. Terminal for the writable; the
 * failed chunk is not retried.
 */
public class SinkFaultException extends StreamException {

    public SinkFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
