package com.opentext.streaming.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * <p>
 * Each stream owns one of these, so all of its events happen on a single logical flow of control
 * while independent streams still run in parallel on the shared pool. At most one drainer is
 * scheduled at a time; a drainer that finishes while tasks are still queued reschedules itself.
 * </p>
 */
@Slf4j
public class SerialExecutor implements Executor {

    private final Executor delegate;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    /** Guard ensuring only one drainer runs at a time. */
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public SerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(Objects.requireNonNull(task, "task"));
        if (draining.compareAndSet(false, true)) {
            schedule();
        }
    }

    private void schedule() {
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            throw e;
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Unhandled exception in stream task", e);
                }
            }
        } finally {
            draining.set(false);
            if (!tasks.isEmpty() && draining.compareAndSet(false, true)) {
                schedule();
            }
        }
    }
}
