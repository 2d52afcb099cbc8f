package com.opentext.streaming.service;

import com.opentext.streaming.model.ChunkSink;
import com.opentext.streaming.model.ChunkSource;
import com.opentext.streaming.model.ChunkTransformer;
import com.opentext.streaming.model.StreamOptions;
import com.opentext.streaming.stream.DuplexStream;
import com.opentext.streaming.stream.ReadableStream;
import com.opentext.streaming.stream.TransformStream;
import com.opentext.streaming.stream.WritableStream;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Builds streams with the configured defaults, all sharing one worker pool.
 * The pool is created lazily and re-created if it was shut down.
 */
@Slf4j
@Service
public class StreamFactory {

    @Value("${stream.high-water-mark:16384}")
    private long highWaterMark = StreamOptions.DEFAULT_HIGH_WATER_MARK;

    @Value("${stream.object-high-water-mark:16}")
    private long objectHighWaterMark = StreamOptions.DEFAULT_OBJECT_HIGH_WATER_MARK;

    @Value("${stream.max-buffered-bytes:0}")
    private long maxBufferedBytes;

    @Value("${stream.executor.pool-size:0}")
    private int poolSize;

    @Value("${stream.shutdown.timeout.seconds:30}")
    private long shutdownTimeoutSeconds = 30;

    private volatile ExecutorService executor;

    /**
     * Ensure the worker pool exists and is usable. Sized by configuration or by the number of
     * available processors.
     */
    private synchronized ExecutorService ensureExecutor() {
        if (executor == null || executor.isShutdown()) {
            int effectiveSize = poolSize > 0 ? poolSize : Math.max(2, Runtime.getRuntime().availableProcessors());
            if (poolSize <= 0 && log.isDebugEnabled()) {
                log.debug("The stream.executor.pool-size={}, using {} threads", poolSize, effectiveSize);
            }
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("stream-worker-");
            threadFactory.setDaemon(true);
            executor = Executors.newFixedThreadPool(effectiveSize, threadFactory);
            if (log.isDebugEnabled()) {
                log.debug("Created stream worker pool with {} threads", effectiveSize);
            }
        }
        return executor;
    }

    public StreamOptions options() {
        return options(false);
    }

    public StreamOptions options(boolean objectMode) {
        return StreamOptions.builder()
                .objectMode(objectMode)
                .highWaterMark(objectMode ? objectHighWaterMark : highWaterMark)
                .maxBufferedBytes(maxBufferedBytes)
                .executor(ensureExecutor())
                .build();
    }

    public ReadableStream readable() {
        return new ReadableStream(options());
    }

    public ReadableStream readable(ChunkSource source) {
        return new ReadableStream(source, options());
    }

    public WritableStream writable(ChunkSink sink) {
        return new WritableStream(sink, options());
    }

    public TransformStream transform(ChunkTransformer transformer) {
        return new TransformStream(transformer, options());
    }

    public DuplexStream duplex(ChunkSource inbound, ChunkSink outbound) {
        return new DuplexStream(inbound, outbound, options(), options());
    }

    /** Stop the worker pool, waiting for queued stream tasks to complete. */
    @PreDestroy
    public synchronized void shutdown() {
        ExecutorService exec = executor;
        if (exec == null) {
            return;
        }
        exec.shutdown();
        try {
            long effectiveTimeout = shutdownTimeoutSeconds > 0 ? shutdownTimeoutSeconds : 30L;
            if (!exec.awaitTermination(effectiveTimeout, TimeUnit.SECONDS)) {
                log.warn("Stream worker pool did not terminate within {} seconds", effectiveTimeout);
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Stream worker pool shutdown interrupted", e);
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
