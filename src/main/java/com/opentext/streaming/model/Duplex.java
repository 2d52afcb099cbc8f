package com.opentext.streaming.model;

/**
 * A stream that is both readable and writable, such as a transform stage or a bidirectional
 * endpoint.
 */
public interface Duplex extends Readable, Writable {
}
