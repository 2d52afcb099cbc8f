package com.opentext.streaming.pipeline;

import com.opentext.streaming.exception.StreamException;
import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamListener;
import com.opentext.streaming.model.Writable;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One hop of a pipeline. Chunks are forwarded from the source's serial executor, so a
 * {@code false} write pauses the source before its next chunk is emitted.
 */
@Slf4j
final class Pipe implements PipelineHandle {

    private final PipelineCoordinator coordinator;
    private final Readable source;
    private final Writable destination;
    private final boolean endDestination;
    private final AtomicBoolean active = new AtomicBoolean();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    Pipe(PipelineCoordinator coordinator, Readable source, Writable destination, boolean endDestination) {
        this.coordinator = coordinator;
        this.source = source;
        this.destination = destination;
        this.endDestination = endDestination;
    }

    void start() {
        active.set(true);
        coordinator.register(this);
        registrations.add(destination.addListener(new StreamListener() {
            @Override
            public void onDrain() {
                if (active.get()) {
                    coordinator.releaseDrain(Pipe.this);
                }
            }

            @Override
            public void onFinish() {
                if (teardown() && log.isDebugEnabled()) {
                    log.debug("{} finished before {} ended, unpiped", destination.getName(), source.getName());
                }
            }

            @Override
            public void onError(Throwable error) {
                if (teardown()) {
                    source.destroy(error);
                }
            }

            @Override
            public void onClose() {
                if (teardown()) {
                    source.destroy();
                }
            }
        }));
        registrations.add(source.addListener(new StreamListener() {
            @Override
            public void onEnd() {
                if (teardown() && endDestination) {
                    endDestination();
                }
            }

            @Override
            public void onError(Throwable error) {
                if (teardown()) {
                    destination.destroy(error);
                }
            }

            @Override
            public void onClose() {
                if (teardown()) {
                    destination.destroy();
                }
            }
        }));
        // last: attaching the data listener starts the flow of an idle source
        Registration data = source.onData(this::forward);
        registrations.add(data);
        if (!active.get()) {
            data.remove();
            return;
        }
        // a paused or previously unpiped source has to be switched back explicitly
        coordinator.startFlowing(this);
    }

    private void forward(Chunk chunk) {
        if (!active.get()) {
            return;
        }
        boolean accepted;
        try {
            accepted = destination.write(chunk);
        } catch (StreamException e) {
            log.warn("Write from {} to {} failed, tearing down pipe", source.getName(), destination.getName(), e);
            if (teardown()) {
                source.destroy(e);
            }
            return;
        }
        if (!accepted) {
            coordinator.awaitDrain(this);
        }
    }

    void endDestination() {
        if (!destination.isWritable()) {
            log.warn("{} ended but {} is already {}", source.getName(), destination.getName(), destination.getWritableState());
            return;
        }
        destination.end();
    }

    private boolean teardown() {
        if (!active.compareAndSet(true, false)) {
            return false;
        }
        registrations.forEach(Registration::remove);
        coordinator.forget(this);
        return true;
    }

    @Override
    public Readable getSource() {
        return source;
    }

    @Override
    public Writable getDestination() {
        return destination;
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public void unpipe() {
        if (teardown() && log.isDebugEnabled()) {
            log.debug("Unpiped {} from {}", source.getName(), destination.getName());
        }
    }

    @Override
    public String toString() {
        return "Pipe[" + source.getName() + " -> " + destination.getName() + "]";
    }
}
