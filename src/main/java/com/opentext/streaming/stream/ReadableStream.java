package com.opentext.streaming.stream;

import com.opentext.streaming.buffer.ChunkBuffer;
import com.opentext.streaming.exception.BackpressureOverrunException;
import com.opentext.streaming.exception.ProtocolViolationException;
import com.opentext.streaming.exception.SourceFaultException;
import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSource;
import com.opentext.streaming.model.DataListener;
import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.ReadableState;
import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamListener;
import com.opentext.streaming.model.StreamOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Readable stream with flowing and paused consumption modes.
 * <p>
 * Chunks arrive either through {@link #push(Chunk)} or, when built over a {@link ChunkSource}, by
 * pulling one chunk at a time while the stream is flowing and its buffer is below the high-water
 * mark. In flowing mode every chunk is handed to the registered data listeners on this stream's
 * serial executor; a listener that pauses the stream stops emission before the next chunk.
 * In paused mode the consumer pulls with {@link #read()}.
 * </p>
 * <p>
 * State transitions happen under the stream lock; listeners are always invoked outside it, on the
 * serial executor, in the order the transitions happened.
 * </p>
 */
@Slf4j
public class ReadableStream implements Readable {

    private static final AtomicLong IDS = new AtomicLong();

    private final String name;
    private final boolean objectMode;
    private final ChunkSource source;
    private final ChunkBuffer buffer;
    private final SerialExecutor strand;
    private final StreamEvents events;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<DataListener> dataListeners = new CopyOnWriteArrayList<>();
    /** Waiters released once the buffer falls below the high-water mark. */
    private final List<CompletableFuture<Void>> capacityWaiters = new ArrayList<>();
    private final CompletableFuture<Void> ended = new CompletableFuture<>();

    private volatile ReadableState state = ReadableState.IDLE;
    private boolean eofPushed;
    /** A source pull is outstanding. */
    private boolean reading;
    private boolean flowScheduled;

    public ReadableStream() {
        this(null, StreamOptions.defaults());
    }

    public ReadableStream(StreamOptions options) {
        this(null, options);
    }

    /**
     * @param source chunk producer, or null when chunks are pushed by the caller
     */
    public ReadableStream(ChunkSource source, StreamOptions options) {
        this.name = options.getName() != null ? options.getName() : "readable-" + IDS.incrementAndGet();
        this.objectMode = options.isObjectMode();
        this.source = source;
        this.buffer = new ChunkBuffer(options.effectiveHighWaterMark(), objectMode, options.getMaxBufferedBytes());
        this.strand = new SerialExecutor(options.effectiveExecutor());
        this.events = new StreamEvents(name);
    }

    /** Create a stream already holding the given chunks followed by EOF. */
    public static ReadableStream of(StreamOptions options, Chunk... chunks) {
        ReadableStream stream = new ReadableStream(options);
        for (Chunk chunk : chunks) {
            stream.push(chunk);
        }
        stream.pushEof();
        return stream;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean push(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        lock.lock();
        try {
            if (eofPushed) {
                throw new ProtocolViolationException("push() after EOF on " + name);
            }
            if (state.isTerminal()) {
                throw new ProtocolViolationException("push() on " + state + " stream " + name);
            }
            return enqueueLocked(chunk, false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void pushEof() {
        lock.lock();
        try {
            if (eofPushed) {
                throw new ProtocolViolationException("EOF already pushed on " + name);
            }
            if (state.isTerminal()) {
                throw new ProtocolViolationException("pushEof() on " + state + " stream " + name);
            }
            eofPushed = true;
            onEofLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void unshift(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        lock.lock();
        try {
            if (state.isTerminal()) {
                throw new ProtocolViolationException("unshift() on " + state + " stream " + name);
            }
            enqueueLocked(chunk, true);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Chunk read() {
        return read(Integer.MAX_VALUE);
    }

    @Override
    public Chunk read(int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be > 0, got: " + maxBytes);
        }
        lock.lock();
        try {
            if (state.isTerminal()) {
                return null;
            }
            Chunk chunk = buffer.dequeue(maxBytes);
            if (chunk == null) {
                if (eofPushed) {
                    endLocked();
                } else {
                    maybePullLocked();
                }
                return null;
            }
            afterDequeueLocked();
            return chunk;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void pause() {
        lock.lock();
        try {
            if (state.isTerminal() || state == ReadableState.PAUSED) {
                return;
            }
            state = ReadableState.PAUSED;
        } finally {
            lock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Paused {}", name);
        }
    }

    @Override
    public void resume() {
        lock.lock();
        try {
            if (state.isTerminal() || state == ReadableState.FLOWING) {
                return;
            }
            state = ReadableState.FLOWING;
            scheduleFlowLocked();
        } finally {
            lock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Resumed {}", name);
        }
    }

    @Override
    public boolean isPaused() {
        return state == ReadableState.PAUSED;
    }

    /**
     * Register a data consumer. An idle stream switches to flowing mode; a stream explicitly
     * paused beforehand stays paused until {@link #resume()}.
     */
    @Override
    public Registration onData(DataListener listener) {
        Objects.requireNonNull(listener, "listener");
        dataListeners.add(listener);
        lock.lock();
        try {
            if (state == ReadableState.IDLE) {
                state = ReadableState.FLOWING;
                scheduleFlowLocked();
            }
        } finally {
            lock.unlock();
        }
        return () -> removeDataListener(listener);
    }

    /** Removing the last data consumer of a flowing stream pauses it so no chunk is dropped. */
    private void removeDataListener(DataListener listener) {
        if (!dataListeners.remove(listener) || !dataListeners.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            if (state == ReadableState.FLOWING) {
                state = ReadableState.PAUSED;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Registration addListener(StreamListener listener) {
        return events.add(listener);
    }

    @Override
    public ReadableState getReadableState() {
        return state;
    }

    @Override
    public long getReadableBufferedBytes() {
        lock.lock();
        try {
            return buffer.bufferedBytes();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getReadableHighWaterMark() {
        return buffer.highWaterMark();
    }

    @Override
    public CompletableFuture<Void> whenEnded() {
        return ended;
    }

    @Override
    public boolean isDestroyed() {
        ReadableState current = state;
        return current == ReadableState.ERRORED || current == ReadableState.DESTROYED;
    }

    @Override
    public void destroy() {
        destroy(null);
    }

    @Override
    public void destroy(Throwable cause) {
        int discarded;
        lock.lock();
        try {
            if (state.isTerminal()) {
                return;
            }
            state = cause == null ? ReadableState.DESTROYED : ReadableState.ERRORED;
            discarded = buffer.clear();
            releaseCapacityWaitersLocked();
        } finally {
            lock.unlock();
        }
        if (discarded > 0) {
            log.warn("Discarded {} buffered chunk(s) of {} on {}", discarded, name, cause == null ? "destroy" : "error");
        } else if (log.isDebugEnabled()) {
            log.debug("Destroyed {}{}", name, cause == null ? "" : " with error: " + cause);
        }
        strand.execute(() -> {
            if (cause != null) {
                events.fire("error", listener -> listener.onError(cause));
                ended.completeExceptionally(cause);
            } else {
                ended.cancel(false);
            }
            closeSource();
            events.fire("close", StreamListener::onClose);
        });
    }

    /** @return true while buffered size is at or above the high-water mark */
    boolean isAboveHighWaterMark() {
        lock.lock();
        try {
            return buffer.isAboveHighWaterMark();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a future completed once the buffer is below the high-water mark, immediately if it
     * already is, or once the stream terminates
     */
    CompletableFuture<Void> awaitCapacity() {
        lock.lock();
        try {
            if (state.isTerminal() || !buffer.isAboveHighWaterMark()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            capacityWaiters.add(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    private boolean enqueueLocked(Chunk chunk, boolean atHead) {
        if (!objectMode && chunk.isObject()) {
            throw new ProtocolViolationException("Object chunk pushed to byte-mode stream " + name);
        }
        boolean wasEmpty = buffer.isEmpty();
        try {
            if (atHead) {
                buffer.unshift(chunk);
            } else {
                buffer.enqueue(chunk);
            }
        } catch (BackpressureOverrunException e) {
            destroy(e);
            throw e;
        }
        if (state == ReadableState.FLOWING) {
            scheduleFlowLocked();
        } else if (wasEmpty) {
            signalReadable();
        }
        return !buffer.isAboveHighWaterMark();
    }

    private void onEofLocked() {
        if (log.isDebugEnabled()) {
            log.debug("EOF reached on {} with {} chunk(s) buffered", name, buffer.size());
        }
        if (state == ReadableState.FLOWING) {
            scheduleFlowLocked();
        } else if (buffer.isEmpty()) {
            signalReadable();
        }
    }

    private void afterDequeueLocked() {
        if (!capacityWaiters.isEmpty() && !buffer.isAboveHighWaterMark()) {
            releaseCapacityWaitersLocked();
        }
        if (buffer.isEmpty() && eofPushed) {
            endLocked();
        }
    }

    private void scheduleFlowLocked() {
        if (!flowScheduled) {
            flowScheduled = true;
            strand.execute(this::flow);
        }
    }

    /**
     * Emit buffered chunks while the stream stays flowing. The state is re-checked before every
     * chunk so a pause issued by a listener takes effect before the next emission.
     */
    private void flow() {
        while (true) {
            Chunk chunk;
            lock.lock();
            try {
                if (state != ReadableState.FLOWING) {
                    flowScheduled = false;
                    return;
                }
                chunk = buffer.dequeue();
                if (chunk == null) {
                    flowScheduled = false;
                    if (eofPushed) {
                        endLocked();
                    } else {
                        maybePullLocked();
                    }
                    return;
                }
                afterDequeueLocked();
            } finally {
                lock.unlock();
            }
            deliver(chunk);
        }
    }

    private void deliver(Chunk chunk) {
        if (dataListeners.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("No data listener on {}, dropping {}", name, chunk);
            }
            return;
        }
        for (DataListener listener : dataListeners) {
            if (isDestroyed()) {
                return;
            }
            try {
                listener.onData(chunk);
            } catch (RuntimeException e) {
                log.warn("Data listener of {} failed, destroying stream", name, e);
                destroy(e);
                return;
            }
        }
    }

    private void endLocked() {
        if (state.isTerminal()) {
            return;
        }
        state = ReadableState.ENDED;
        releaseCapacityWaitersLocked();
        if (log.isDebugEnabled()) {
            log.debug("Ended {}", name);
        }
        strand.execute(() -> {
            events.fire("end", StreamListener::onEnd);
            ended.complete(null);
            closeSource();
            events.fire("close", StreamListener::onClose);
        });
    }

    private void signalReadable() {
        strand.execute(() -> events.fire("readable", StreamListener::onReadable));
    }

    private void releaseCapacityWaitersLocked() {
        if (capacityWaiters.isEmpty()) {
            return;
        }
        List<CompletableFuture<Void>> released = new ArrayList<>(capacityWaiters);
        capacityWaiters.clear();
        strand.execute(() -> released.forEach(waiter -> waiter.complete(null)));
    }

    /** Ask the source for one more chunk if there is room and no request is outstanding. */
    private void maybePullLocked() {
        if (source == null || reading || eofPushed || state.isTerminal() || buffer.isAboveHighWaterMark()) {
            return;
        }
        reading = true;
        strand.execute(this::pullFromSource);
    }

    private void pullFromSource() {
        CompletionStage<Optional<Chunk>> next;
        try {
            next = Objects.requireNonNull(source.nextChunk(), "nextChunk() returned null");
        } catch (RuntimeException e) {
            next = CompletableFuture.failedFuture(e);
        }
        next.whenComplete((result, error) -> strand.execute(() -> onSourceResult(result, error)));
    }

    private void onSourceResult(Optional<Chunk> result, Throwable error) {
        lock.lock();
        try {
            reading = false;
            if (error != null) {
                destroy(new SourceFaultException("Chunk source of " + name + " failed", Futures.unwrap(error)));
                return;
            }
            if (state.isTerminal()) {
                if (log.isDebugEnabled()) {
                    log.debug("Ignoring source result for {} stream {}", state, name);
                }
                return;
            }
            if (result == null || result.isEmpty()) {
                eofPushed = true;
                onEofLocked();
                return;
            }
            enqueueLocked(result.get(), false);
        } catch (ProtocolViolationException e) {
            destroy(e);
        } catch (BackpressureOverrunException e) {
            log.warn("Source of {} overran the buffer limit", name);
        } finally {
            lock.unlock();
        }
    }

    private void closeSource() {
        if (source == null) {
            return;
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close source of {}", name, e);
        }
    }
}
