package com.opentext.streaming.stream;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Sink whose acknowledgements are completed by the test.
 */
public class ManualAckSink implements ChunkSink {

    public record Delivery(Chunk chunk, CompletableFuture<Void> ack) {
        public void complete() {
            ack.complete(null);
        }
    }

    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();

    @Override
    public CompletionStage<Void> accept(Chunk chunk) {
        CompletableFuture<Void> ack = new CompletableFuture<>();
        deliveries.add(new Delivery(chunk, ack));
        return ack;
    }

    /** @return the next handed-over chunk, or null if none arrived within the timeout */
    public Delivery next(long timeoutMillis) throws InterruptedException {
        return deliveries.poll(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    public Delivery next() throws InterruptedException {
        return next(5000);
    }
}
