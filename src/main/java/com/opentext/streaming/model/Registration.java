package com.opentext.streaming.model;

/**
 * Handle returned when a listener is registered; {@link #remove()} detaches it.
 */
@FunctionalInterface
public interface Registration {
    void remove();
}
