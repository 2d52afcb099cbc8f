package com.opentext.streaming.exception;

/**
 * A caller broke the stream state machine, e.g. {@code write()} after {@code end()}.
 * Thrown synchronously to the caller; the stream state is left untouched.
 */
public class ProtocolViolationException extends StreamException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
