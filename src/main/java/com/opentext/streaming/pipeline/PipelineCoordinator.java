package com.opentext.streaming.pipeline;

import com.opentext.streaming.exception.ProtocolViolationException;
import com.opentext.streaming.model.ChunkStream;
import com.opentext.streaming.model.Duplex;
import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.ReadableState;
import com.opentext.streaming.model.Writable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects readables to writables, propagating backpressure, completion and errors.
 * <p>
 * Per hop: the source is switched to flowing mode, every emitted chunk is written to the
 * destination, a {@code false} write pauses the source until the destination drains, the source's
 * end ends the destination, and an error or destroy on either end is forwarded to the other before
 * the hop is torn down. A source piped to several destinations resumes only once every destination
 * it waits on has drained. Chains are built hop by hop through transform stages.
 * </p>
 */
@Slf4j
@Component
public class PipelineCoordinator {

    /** Active pipes per source, with those waiting for their destination to drain. */
    private final ConcurrentHashMap<Readable, PipeGroup> pipes = new ConcurrentHashMap<>();

    public PipelineHandle pipe(Readable source, Writable destination) {
        return pipe(source, destination, true);
    }

    /**
     * @param endDestination whether the destination is ended when the source ends
     */
    public PipelineHandle pipe(Readable source, Writable destination, boolean endDestination) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        if (source == destination) {
            throw new IllegalArgumentException("Cannot pipe " + source.getName() + " into itself");
        }
        if (!destination.isWritable()) {
            throw new ProtocolViolationException("Cannot pipe into " + destination.getWritableState()
                    + " stream " + destination.getName());
        }
        Pipe pipe = new Pipe(this, source, destination, endDestination);
        ReadableState sourceState = source.getReadableState();
        if (sourceState == ReadableState.ENDED) {
            if (endDestination) {
                pipe.endDestination();
            }
            return pipe;
        }
        if (source.isDestroyed()) {
            destination.destroy();
            return pipe;
        }
        pipe.start();
        if (log.isDebugEnabled()) {
            log.debug("Piped {} -> {}", source.getName(), destination.getName());
        }
        return pipe;
    }

    public CompletableFuture<Void> pipeline(Readable source, Writable destination) {
        return pipeline(source, List.of(), destination);
    }

    /**
     * Pipe {@code source} through every stage into {@code destination}.
     *
     * @return a future completed when the destination finished; on the first error every stream of
     * the chain is destroyed with it and the future fails with it
     */
    public CompletableFuture<Void> pipeline(Readable source, List<? extends Duplex> stages, Writable destination) {
        List<ChunkStream> streams = new ArrayList<>();
        streams.add(source);
        streams.addAll(stages);
        streams.add(destination);

        CompletableFuture<Void> result = new CompletableFuture<>();
        AtomicBoolean failed = new AtomicBoolean();
        for (ChunkStream stream : streams) {
            stream.onError(error -> failPipeline(streams, result, failed, error));
        }
        destination.whenFinished().whenComplete((ignored, error) -> {
            if (error == null) {
                result.complete(null);
            } else {
                failPipeline(streams, result, failed, error);
            }
        });

        Readable upstream = source;
        for (Duplex stage : stages) {
            pipe(upstream, stage);
            upstream = stage;
        }
        pipe(upstream, destination);
        return result;
    }

    private void failPipeline(List<ChunkStream> streams, CompletableFuture<Void> result,
                              AtomicBoolean failed, Throwable error) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        log.warn("Pipeline {} -> {} failed: {}", streams.get(0).getName(),
                streams.get(streams.size() - 1).getName(), error.toString());
        streams.forEach(stream -> stream.destroy(error));
        result.completeExceptionally(error);
    }

    /** Record a pipe whose data listener is about to be attached. */
    void register(Pipe pipe) {
        pipes.compute(pipe.getSource(), (source, group) -> {
            PipeGroup pipesOfSource = group != null ? group : new PipeGroup();
            pipesOfSource.active.add(pipe);
            return pipesOfSource;
        });
    }

    /** Switch the source to flowing unless another destination still holds it paused. */
    void startFlowing(Pipe pipe) {
        pipes.computeIfPresent(pipe.getSource(), (source, group) -> {
            if (group.active.contains(pipe) && group.waiting.isEmpty()) {
                source.resume();
            }
            return group;
        });
    }

    /** Pause the pipe's source until its destination drains. */
    void awaitDrain(Pipe pipe) {
        pipes.computeIfPresent(pipe.getSource(), (source, group) -> {
            if (group.active.contains(pipe)) {
                group.waiting.add(pipe);
                source.pause();
            }
            return group;
        });
        // the drain may have fired before the pipe was marked waiting; a failed destination never
        // releases, its error tears the pipe down instead
        Writable destination = pipe.getDestination();
        if (destination.isWritable() && !destination.needsDrain()) {
            releaseDrain(pipe);
        }
    }

    /** Resume the source once no destination is left waiting for drain. */
    void releaseDrain(Pipe pipe) {
        pipes.computeIfPresent(pipe.getSource(), (source, group) -> {
            if (group.waiting.remove(pipe) && group.waiting.isEmpty()) {
                source.resume();
            }
            return group;
        });
    }

    /**
     * Drop a torn down pipe. If it was the last destination the source waited on, the remaining
     * destinations get the flow back.
     */
    void forget(Pipe pipe) {
        pipes.computeIfPresent(pipe.getSource(), (source, group) -> {
            group.active.remove(pipe);
            if (group.waiting.remove(pipe) && group.waiting.isEmpty() && !group.active.isEmpty()) {
                source.resume();
            }
            return group.active.isEmpty() ? null : group;
        });
    }

    /** Pipes of one source; only touched inside {@code pipes.compute*}. */
    private static final class PipeGroup {
        private final Set<Pipe> active = new HashSet<>();
        private final Set<Pipe> waiting = new HashSet<>();
    }
}
