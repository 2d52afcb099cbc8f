package com.opentext.streaming.model;

/**
 * Consumer of chunks emitted by a readable stream in flowing mode.
 */
@FunctionalInterface
public interface DataListener {
    void onData(Chunk chunk);
}
