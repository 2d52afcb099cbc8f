package com.opentext.streaming.stream;

import com.opentext.streaming.buffer.ChunkBuffer;
import com.opentext.streaming.exception.BackpressureOverrunException;
import com.opentext.streaming.exception.ProtocolViolationException;
import com.opentext.streaming.exception.SinkFaultException;
import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;
import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamListener;
import com.opentext.streaming.model.StreamOptions;
import com.opentext.streaming.model.Writable;
import com.opentext.streaming.model.WritableState;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Writable stream forwarding chunks to a {@link ChunkSink}.
 * <p>
 * {@link #write(Chunk)} only queues; delivery runs on this stream's serial executor, one chunk at a
 * time, the next chunk being handed over only after the previous one was acknowledged. The chunk
 * being delivered stays in the buffer until acknowledged, so it counts against the high-water mark.
 * </p>
 * <p>
 * A sink fault moves the stream to ERRORED, drops everything still queued and is never retried.
 * </p>
 */
@Slf4j
public class WritableStream implements Writable {

    private static final AtomicLong IDS = new AtomicLong();
    private static final BooleanSupplier NO_PRESSURE = () -> false;

    private final String name;
    private final boolean objectMode;
    private final ChunkSink sink;
    private final ChunkBuffer buffer;
    private final SerialExecutor strand;
    private final StreamEvents events;
    /** Extra saturation signal coming from a coupled readable side. */
    private final BooleanSupplier downstreamPressure;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<Void> finished = new CompletableFuture<>();

    private volatile WritableState state = WritableState.IDLE;
    /** A chunk is handed to the sink and not yet acknowledged. */
    private boolean writing;
    private boolean deliveryScheduled;
    private boolean needDrain;
    private boolean finishing;
    private long deliveredBytes;

    public WritableStream(ChunkSink sink) {
        this(sink, StreamOptions.defaults());
    }

    public WritableStream(ChunkSink sink, StreamOptions options) {
        this(sink, options, NO_PRESSURE);
    }

    WritableStream(ChunkSink sink, StreamOptions options, BooleanSupplier downstreamPressure) {
        this.name = options.getName() != null ? options.getName() : "writable-" + IDS.incrementAndGet();
        this.objectMode = options.isObjectMode();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.buffer = new ChunkBuffer(options.effectiveHighWaterMark(), objectMode, options.getMaxBufferedBytes());
        this.strand = new SerialExecutor(options.effectiveExecutor());
        this.events = new StreamEvents(name);
        this.downstreamPressure = downstreamPressure;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean write(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        lock.lock();
        try {
            if (state == WritableState.ENDING || state == WritableState.FINISHED) {
                throw new ProtocolViolationException("write() after end() on " + name);
            }
            if (state.isTerminal()) {
                throw new ProtocolViolationException("write() on " + state + " stream " + name);
            }
            if (!objectMode && chunk.isObject()) {
                throw new ProtocolViolationException("Object chunk written to byte-mode stream " + name);
            }
            try {
                buffer.enqueue(chunk);
            } catch (BackpressureOverrunException e) {
                destroy(e);
                throw e;
            }
            if (state == WritableState.IDLE) {
                state = WritableState.ACTIVE;
            }
            boolean accepted = !isSaturatedLocked();
            if (!accepted) {
                needDrain = true;
            }
            scheduleDeliveryLocked();
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void end() {
        lock.lock();
        try {
            if (state == WritableState.ENDING || state == WritableState.FINISHED) {
                throw new ProtocolViolationException("end() called twice on " + name);
            }
            if (state.isTerminal()) {
                throw new ProtocolViolationException("end() on " + state + " stream " + name);
            }
            state = WritableState.ENDING;
            scheduleDeliveryLocked();
        } finally {
            lock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Ending {}", name);
        }
    }

    @Override
    public boolean isWritable() {
        return state.acceptsWrites();
    }

    @Override
    public boolean needsDrain() {
        lock.lock();
        try {
            return needDrain;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WritableState getWritableState() {
        return state;
    }

    @Override
    public long getWritableBufferedBytes() {
        lock.lock();
        try {
            return buffer.bufferedBytes();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getWritableHighWaterMark() {
        return buffer.highWaterMark();
    }

    /** @return total bytes acknowledged by the sink so far */
    public long getDeliveredBytes() {
        lock.lock();
        try {
            return deliveredBytes;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletableFuture<Void> whenFinished() {
        return finished;
    }

    @Override
    public Registration addListener(StreamListener listener) {
        return events.add(listener);
    }

    @Override
    public boolean isDestroyed() {
        WritableState current = state;
        return current == WritableState.ERRORED || current == WritableState.DESTROYED;
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
            state = cause == null ? WritableState.DESTROYED : WritableState.ERRORED;
            discarded = buffer.clear();
            needDrain = false;
        } finally {
            lock.unlock();
        }
        if (discarded > 0) {
            log.warn("Discarded {} undelivered chunk(s) of {} on {}", discarded, name, cause == null ? "destroy" : "error");
        } else if (log.isDebugEnabled()) {
            log.debug("Destroyed {}{}", name, cause == null ? "" : " with error: " + cause);
        }
        strand.execute(() -> {
            abortSink(cause);
            if (cause != null) {
                events.fire("error", listener -> listener.onError(cause));
                finished.completeExceptionally(cause);
            } else {
                finished.cancel(false);
            }
            events.fire("close", StreamListener::onClose);
        });
    }

    /** Re-evaluate a pending drain after the coupled readable side released capacity. */
    void recheckDrain() {
        strand.execute(() -> {
            boolean drain;
            lock.lock();
            try {
                drain = checkDrainLocked();
            } finally {
                lock.unlock();
            }
            if (drain) {
                emitDrain();
            }
        });
    }

    private boolean isSaturatedLocked() {
        return buffer.isAboveHighWaterMark() || downstreamPressure.getAsBoolean();
    }

    private boolean checkDrainLocked() {
        if (needDrain && !state.isTerminal() && !isSaturatedLocked()) {
            needDrain = false;
            return true;
        }
        return false;
    }

    private void scheduleDeliveryLocked() {
        if (!writing && !deliveryScheduled) {
            deliveryScheduled = true;
            strand.execute(this::deliverNext);
        }
    }

    private void deliverNext() {
        Chunk chunk;
        lock.lock();
        try {
            deliveryScheduled = false;
            if (writing || state.isTerminal()) {
                return;
            }
            chunk = buffer.peek();
            if (chunk == null) {
                if (state == WritableState.ENDING) {
                    startFinishLocked();
                }
                return;
            }
            writing = true;
        } finally {
            lock.unlock();
        }
        CompletionStage<Void> ack;
        try {
            ack = Objects.requireNonNull(sink.accept(chunk), "accept() returned null");
        } catch (RuntimeException e) {
            ack = CompletableFuture.failedFuture(e);
        }
        ack.whenComplete((ignored, error) -> strand.execute(() -> onAcknowledged(chunk, error)));
    }

    private void onAcknowledged(Chunk chunk, Throwable error) {
        if (error != null) {
            destroy(new SinkFaultException("Chunk sink of " + name + " rejected " + chunk, Futures.unwrap(error)));
            return;
        }
        boolean drain;
        lock.lock();
        try {
            if (state.isTerminal()) {
                return;
            }
            buffer.dequeue();
            writing = false;
            deliveredBytes += chunk.length();
            drain = checkDrainLocked();
            if (!buffer.isEmpty()) {
                scheduleDeliveryLocked();
            } else if (state == WritableState.ENDING) {
                startFinishLocked();
            }
        } finally {
            lock.unlock();
        }
        if (drain) {
            emitDrain();
        }
    }

    private void emitDrain() {
        if (log.isDebugEnabled()) {
            log.debug("Drained {}", name);
        }
        events.fire("drain", StreamListener::onDrain);
    }

    private void startFinishLocked() {
        if (!finishing) {
            finishing = true;
            strand.execute(this::finishSink);
        }
    }

    private void finishSink() {
        CompletionStage<Void> done;
        try {
            done = Objects.requireNonNull(sink.finish(), "finish() returned null");
        } catch (RuntimeException e) {
            done = CompletableFuture.failedFuture(e);
        }
        done.whenComplete((ignored, error) -> strand.execute(() -> onSinkFinished(error)));
    }

    private void onSinkFinished(Throwable error) {
        if (error != null) {
            destroy(new SinkFaultException("Chunk sink of " + name + " failed to finish", Futures.unwrap(error)));
            return;
        }
        long total;
        lock.lock();
        try {
            if (state != WritableState.ENDING) {
                return;
            }
            state = WritableState.FINISHED;
            total = deliveredBytes;
        } finally {
            lock.unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("Finished {} after delivering {} bytes", name, total);
        }
        events.fire("finish", StreamListener::onFinish);
        finished.complete(null);
        events.fire("close", StreamListener::onClose);
    }

    private void abortSink(Throwable cause) {
        try {
            sink.abort(cause);
        } catch (RuntimeException e) {
            log.warn("Failed to abort sink of {}", name, e);
        }
    }
}
