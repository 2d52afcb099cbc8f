package com.opentext.streaming.exception;

/**
 * Base class of every fault raised by the streaming engine.
 */
public abstract class StreamException extends RuntimeException {

    protected StreamException(String message) {
        super(message);
    }

    protected StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
