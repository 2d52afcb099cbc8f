package com.opentext.streaming.exception;

/**
 * The external chunk source failed to produce a chunk. Terminal for the readable.
 */
public class SourceFaultException extends StreamException {

    public SourceFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
