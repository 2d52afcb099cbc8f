package com.opentext.streaming.service;

import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.Writable;
import com.opentext.streaming.pipeline.PipelineCoordinator;
import com.opentext.streaming.stream.TransformStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Run-length compression over streams. Every call builds a fresh transform stage, so the service
 * itself holds no per-stream state and content is never materialized in memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompressionService {

    public enum Operation {
        COMPRESS,
        DECOMPRESS
    }

    private final StreamFactory streamFactory;
    private final PipelineCoordinator coordinator;

    public TransformStream compressor() {
        return streamFactory.transform(new RleEncoder());
    }

    public TransformStream decompressor() {
        return streamFactory.transform(new RleDecoder());
    }

    /**
     * Pipe {@code source} through a compressor or decompressor into {@code destination}.
     *
     * @return a future completed once the destination finished
     */
    public CompletableFuture<Void> process(Readable source, Writable destination, Operation operation) {
        TransformStream stage = operation == Operation.COMPRESS ? compressor() : decompressor();
        if (log.isDebugEnabled()) {
            log.debug("{} {} -> {} via {}", operation, source.getName(), destination.getName(), stage.getName());
        }
        return coordinator.pipeline(source, List.of(stage), destination);
    }
}
