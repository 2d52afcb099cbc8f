package com.opentext.streaming.pipeline;

import com.opentext.streaming.model.Readable;
import com.opentext.streaming.model.Writable;

/**
 * Wiring between one readable and one writable created by {@link PipelineCoordinator#pipe}.
 * It owns no data; it only forwards chunks, backpressure, completion and errors.
 */
public interface PipelineHandle {

    Readable getSource();

    Writable getDestination();

    /** @return false once either end ended, failed or the pipe was unpiped */
    boolean isActive();

    /**
     * Detach the wiring. Neither stream is ended or destroyed; a source left without data
     * listeners stops flowing and keeps its buffered chunks.
     */
    void unpipe();
}
