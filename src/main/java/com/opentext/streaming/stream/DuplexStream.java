package com.opentext.streaming.stream;

import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSink;
import com.opentext.streaming.model.ChunkSource;
import com.opentext.streaming.model.StreamOptions;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bidirectional endpoint: an inbound readable and an outbound writable with independent buffers.
 * Backpressure on one direction never affects the other.
 */
public class DuplexStream extends AbstractDuplexStream {

    private static final AtomicLong IDS = new AtomicLong();

    public DuplexStream(ChunkSource inbound, ChunkSink outbound) {
        this(inbound, outbound, StreamOptions.defaults(), StreamOptions.defaults());
    }

    public DuplexStream(ChunkSource inbound, ChunkSink outbound,
                        StreamOptions readableOptions, StreamOptions writableOptions) {
        this(nameOf(readableOptions), inbound, outbound, readableOptions, writableOptions);
    }

    private DuplexStream(String name, ChunkSource inbound, ChunkSink outbound,
                         StreamOptions readableOptions, StreamOptions writableOptions) {
        this(name,
                new ReadableStream(inbound, rename(readableOptions, name + ".in")),
                new WritableStream(outbound, rename(writableOptions, name + ".out")));
    }

    DuplexStream(String name, ReadableStream readable, WritableStream writable) {
        super(name, readable, writable);
    }

    private static String nameOf(StreamOptions options) {
        return options.getName() != null ? options.getName() : "duplex-" + IDS.incrementAndGet();
    }

    public static Pair pair() {
        return pair(StreamOptions.defaults());
    }

    /**
     * Build two connected in-memory endpoints: chunks written to one appear on the other's
     * readable side, and ending one side's writable pushes EOF to its peer. A write is
     * acknowledged once the peer's readable buffer is below its high-water mark. Destroying one
     * endpoint destroys the peer's inbound side.
     */
    public static Pair pair(StreamOptions options) {
        long id = IDS.incrementAndGet();
        String firstName = "duplex-" + id + "-a";
        String secondName = "duplex-" + id + "-b";
        ReadableStream firstInbound = new ReadableStream(null, rename(options, firstName + ".in"));
        ReadableStream secondInbound = new ReadableStream(null, rename(options, secondName + ".in"));
        WritableStream firstOutbound = new WritableStream(new PeerSink(secondInbound), rename(options, firstName + ".out"));
        WritableStream secondOutbound = new WritableStream(new PeerSink(firstInbound), rename(options, secondName + ".out"));
        return new Pair(
                new DuplexStream(firstName, firstInbound, firstOutbound),
                new DuplexStream(secondName, secondInbound, secondOutbound));
    }

    /** Two endpoints built by {@link #pair(StreamOptions)}. */
    public record Pair(DuplexStream first, DuplexStream second) {
    }

    private static final class PeerSink implements ChunkSink {

        private final ReadableStream peer;

        private PeerSink(ReadableStream peer) {
            this.peer = peer;
        }

        @Override
        public CompletionStage<Void> accept(Chunk chunk) {
            peer.push(chunk);
            return peer.awaitCapacity();
        }

        @Override
        public CompletionStage<Void> finish() {
            peer.pushEof();
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void abort(Throwable cause) {
            peer.destroy(cause);
        }
    }
}
