package com.opentext.streaming.stream;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.DataListener;
import com.opentext.streaming.model.Duplex;
import com.opentext.streaming.model.ReadableState;
import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamListener;
import com.opentext.streaming.model.StreamOptions;
import com.opentext.streaming.model.WritableState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A readable side and a writable side presented as one stream.
 * <p>
 * Each side keeps its own buffer and serial executor. Lifecycle events of both sides are
 * re-published on this stream's listeners: the first error of either side is reported once and
 * destroys the other side, and {@code onClose} fires once both sides have closed. Since the two
 * sides run independently, listeners may be called from two threads.
 * </p>
 */
public abstract class AbstractDuplexStream implements Duplex {

    protected final ReadableStream readable;
    protected final WritableStream writable;
    private final String name;
    private final StreamEvents events;
    private final AtomicBoolean errorReported = new AtomicBoolean();
    private final AtomicInteger closedSides = new AtomicInteger();

    protected AbstractDuplexStream(String name, ReadableStream readable, WritableStream writable) {
        this.name = name;
        this.readable = readable;
        this.writable = writable;
        this.events = new StreamEvents(name);
        readable.addListener(new StreamListener() {
            @Override
            public void onReadable() {
                events.fire("readable", StreamListener::onReadable);
            }

            @Override
            public void onEnd() {
                events.fire("end", StreamListener::onEnd);
            }

            @Override
            public void onError(Throwable error) {
                sideFailed(error);
            }

            @Override
            public void onClose() {
                sideClosed();
            }
        });
        writable.addListener(new StreamListener() {
            @Override
            public void onDrain() {
                events.fire("drain", StreamListener::onDrain);
            }

            @Override
            public void onFinish() {
                events.fire("finish", StreamListener::onFinish);
            }

            @Override
            public void onError(Throwable error) {
                sideFailed(error);
            }

            @Override
            public void onClose() {
                sideClosed();
            }
        });
    }

    static StreamOptions rename(StreamOptions options, String name) {
        return options.toBuilder().name(name).build();
    }

    private void sideFailed(Throwable error) {
        if (errorReported.compareAndSet(false, true)) {
            events.fire("error", listener -> listener.onError(error));
            readable.destroy(error);
            writable.destroy(error);
        }
    }

    private void sideClosed() {
        if (closedSides.incrementAndGet() == 2) {
            events.fire("close", StreamListener::onClose);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Registration addListener(StreamListener listener) {
        return events.add(listener);
    }

    @Override
    public void destroy() {
        readable.destroy();
        writable.destroy();
    }

    @Override
    public void destroy(Throwable cause) {
        readable.destroy(cause);
        writable.destroy(cause);
    }

    @Override
    public boolean isDestroyed() {
        return readable.isDestroyed() || writable.isDestroyed();
    }

    // readable side

    @Override
    public boolean push(Chunk chunk) {
        return readable.push(chunk);
    }

    @Override
    public void pushEof() {
        readable.pushEof();
    }

    @Override
    public void unshift(Chunk chunk) {
        readable.unshift(chunk);
    }

    @Override
    public Chunk read() {
        return readable.read();
    }

    @Override
    public Chunk read(int maxBytes) {
        return readable.read(maxBytes);
    }

    @Override
    public void pause() {
        readable.pause();
    }

    @Override
    public void resume() {
        readable.resume();
    }

    @Override
    public boolean isPaused() {
        return readable.isPaused();
    }

    @Override
    public Registration onData(DataListener listener) {
        return readable.onData(listener);
    }

    @Override
    public ReadableState getReadableState() {
        return readable.getReadableState();
    }

    @Override
    public long getReadableBufferedBytes() {
        return readable.getReadableBufferedBytes();
    }

    @Override
    public long getReadableHighWaterMark() {
        return readable.getReadableHighWaterMark();
    }

    @Override
    public CompletableFuture<Void> whenEnded() {
        return readable.whenEnded();
    }

    // writable side

    @Override
    public boolean write(Chunk chunk) {
        return writable.write(chunk);
    }

    @Override
    public void end() {
        writable.end();
    }

    @Override
    public boolean isWritable() {
        return writable.isWritable();
    }

    @Override
    public boolean needsDrain() {
        return writable.needsDrain();
    }

    @Override
    public WritableState getWritableState() {
        return writable.getWritableState();
    }

    @Override
    public long getWritableBufferedBytes() {
        return writable.getWritableBufferedBytes();
    }

    @Override
    public long getWritableHighWaterMark() {
        return writable.getWritableHighWaterMark();
    }

    @Override
    public CompletableFuture<Void> whenFinished() {
        return writable.whenFinished();
    }
}
