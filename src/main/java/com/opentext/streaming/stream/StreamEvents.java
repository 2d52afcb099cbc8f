package com.opentext.streaming.stream;

import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listener registry of one stream. A listener that throws is logged and the remaining listeners
 * still receive the event.
 */
@Slf4j
class StreamEvents {

    private final String streamName;
    private final List<StreamListener> listeners = new CopyOnWriteArrayList<>();

    StreamEvents(String streamName) {
        this.streamName = streamName;
    }

    Registration add(StreamListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    void fire(String event, Consumer<StreamListener> action) {
        for (StreamListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} event of {}", event, streamName, e);
            }
        }
    }
}
