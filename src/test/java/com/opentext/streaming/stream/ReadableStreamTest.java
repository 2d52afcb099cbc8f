package com.opentext.streaming.stream;

import com.opentext.streaming.exception.BackpressureOverrunException;
import com.opentext.streaming.exception.ProtocolViolationException;
import com.opentext.streaming.exception.SourceFaultException;
import com.opentext.streaming.model.Chunk;
import com.opentext.streaming.model.ChunkSource;
import com.opentext.streaming.model.ReadableState;
import com.opentext.streaming.model.Registration;
import com.opentext.streaming.model.StreamOptions;
import com.opentext.streaming.repository.InMemoryChunkSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ReadableStreamTest {

    private static List<String> collect(ReadableStream stream) {
        List<String> received = Collections.synchronizedList(new ArrayList<>());
        stream.onData(chunk -> received.add(chunk.asString()));
        return received;
    }

    @Test
    void testFlowingDeliversInOrderThenEnds() throws Exception {
        ReadableStream stream = ReadableStream.of(StreamOptions.defaults(),
                Chunk.of("ab"), Chunk.of("cd"), Chunk.of("ef"));
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        stream.onEnd(() -> events.add("end"));
        stream.onData(chunk -> events.add(chunk.asString()));

        stream.whenEnded().get(5, TimeUnit.SECONDS);
        assertEquals(List.of("ab", "cd", "ef", "end"), events);
        assertEquals(ReadableState.ENDED, stream.getReadableState());
    }

    @Test
    void testZeroLengthChunkIsNotEof() throws Exception {
        ReadableStream stream = new ReadableStream();
        CountDownLatch threeChunks = new CountDownLatch(3);
        List<Integer> lengths = Collections.synchronizedList(new ArrayList<>());
        stream.onData(chunk -> {
            lengths.add(chunk.length());
            threeChunks.countDown();
        });

        stream.push(Chunk.of("a"));
        stream.push(Chunk.empty());
        stream.push(Chunk.of("b"));
        assertTrue(threeChunks.await(5, TimeUnit.SECONDS));
        assertFalse(stream.whenEnded().isDone());
        assertEquals(ReadableState.FLOWING, stream.getReadableState());

        stream.pushEof();
        stream.whenEnded().get(5, TimeUnit.SECONDS);
        assertEquals(List.of(1, 0, 1), lengths);
    }

    @Test
    void testPushReturnsFalseAtHighWaterMark() {
        ReadableStream stream = new ReadableStream(StreamOptions.withHighWaterMark(4));
        assertTrue(stream.push(Chunk.of("ab")));
        assertFalse(stream.push(Chunk.of("cd")));
        // advisory only: the chunk is still buffered
        assertFalse(stream.push(Chunk.of("ef")));
        assertEquals(6, stream.getReadableBufferedBytes());
        assertEquals(4, stream.getReadableHighWaterMark());
    }

    @Test
    void testPushAfterEofIsProtocolViolation() {
        ReadableStream stream = new ReadableStream();
        stream.pushEof();
        assertThrows(ProtocolViolationException.class, () -> stream.push(Chunk.of("late")));
        assertThrows(ProtocolViolationException.class, stream::pushEof);
    }

    @Test
    void testPausedReadWithLimit() throws Exception {
        ReadableStream stream = new ReadableStream();
        stream.push(Chunk.of("hello"));
        stream.pushEof();

        assertEquals("he", stream.read(2).asString());
        assertEquals(3, stream.getReadableBufferedBytes());
        assertEquals("llo", stream.read().asString());
        assertEquals(ReadableState.ENDED, stream.getReadableState());
        assertNull(stream.read());
        stream.whenEnded().get(5, TimeUnit.SECONDS);
    }

    @Test
    void testReadOnEmptyBufferReturnsNull() {
        ReadableStream stream = new ReadableStream();
        assertNull(stream.read());
        assertEquals(ReadableState.IDLE, stream.getReadableState());
    }

    @Test
    void testUnshift() {
        ReadableStream stream = new ReadableStream();
        stream.push(Chunk.of("world"));
        stream.unshift(Chunk.of("hello "));
        assertEquals("hello ", stream.read().asString());
        assertEquals("world", stream.read().asString());
    }

    @Test
    void testPauseFromListenerStopsBeforeNextChunk() throws Exception {
        ReadableStream stream = new ReadableStream();
        stream.push(Chunk.of("a"));
        stream.push(Chunk.of("b"));
        stream.push(Chunk.of("c"));

        List<String> received = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch first = new CountDownLatch(1);
        AtomicBoolean pausedOnce = new AtomicBoolean();
        stream.onData(chunk -> {
            received.add(chunk.asString());
            if (pausedOnce.compareAndSet(false, true)) {
                stream.pause();
                first.countDown();
            }
        });

        assertTrue(first.await(5, TimeUnit.SECONDS));
        assertTrue(stream.isPaused());
        assertEquals(List.of("a"), received);
        assertEquals(2, stream.getReadableBufferedBytes());

        stream.resume();
        stream.pushEof();
        stream.whenEnded().get(5, TimeUnit.SECONDS);
        assertEquals(List.of("a", "b", "c"), received);
    }

    @Test
    void testPauseAndResumeAreIdempotent() {
        ReadableStream stream = new ReadableStream();
        stream.pause();
        stream.pause();
        assertTrue(stream.isPaused());
        stream.resume();
        stream.resume();
        assertEquals(ReadableState.FLOWING, stream.getReadableState());
    }

    @Test
    void testExplicitPauseBeforeDataListenerPreventsFlow() {
        ReadableStream stream = new ReadableStream();
        stream.pause();
        stream.onData(chunk -> fail("no chunk expected while paused"));
        stream.push(Chunk.of("x"));
        assertEquals(ReadableState.PAUSED, stream.getReadableState());
        assertEquals("x", stream.read().asString());
    }

    @Test
    void testRemovingLastDataListenerPauses() {
        ReadableStream stream = new ReadableStream();
        Registration registration = stream.onData(chunk -> {
        });
        assertEquals(ReadableState.FLOWING, stream.getReadableState());
        registration.remove();
        assertEquals(ReadableState.PAUSED, stream.getReadableState());
    }

    @Test
    void testReadableEventInPausedMode() throws Exception {
        ReadableStream stream = new ReadableStream();
        CountDownLatch readable = new CountDownLatch(1);
        stream.onReadable(readable::countDown);
        stream.push(Chunk.of("x"));
        assertTrue(readable.await(5, TimeUnit.SECONDS));
        assertEquals("x", stream.read().asString());
    }

    @Test
    void testObjectMode() {
        ReadableStream stream = new ReadableStream(StreamOptions.builder().objectMode(true).highWaterMark(2L).build());
        assertTrue(stream.push(Chunk.ofObject("first")));
        assertFalse(stream.push(Chunk.ofObject("second")));
        assertEquals(2, stream.getReadableBufferedBytes());
        assertEquals("first", stream.read().value());
    }

    @Test
    void testByteModeRejectsObjectChunk() {
        ReadableStream stream = new ReadableStream();
        assertThrows(ProtocolViolationException.class, () -> stream.push(Chunk.ofObject(1)));
        assertEquals(0, stream.getReadableBufferedBytes());
    }

    @Test
    void testDestroyWithError() throws Exception {
        ReadableStream stream = new ReadableStream();
        stream.push(Chunk.of("pending"));
        AtomicReference<Throwable> reported = new AtomicReference<>();
        CountDownLatch closed = new CountDownLatch(1);
        stream.onError(reported::set);
        stream.onClose(closed::countDown);

        IllegalStateException boom = new IllegalStateException("boom");
        stream.destroy(boom);

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertSame(boom, reported.get());
        assertEquals(ReadableState.ERRORED, stream.getReadableState());
        assertTrue(stream.isDestroyed());
        assertEquals(0, stream.getReadableBufferedBytes());
        assertNull(stream.read());
        assertThrows(ProtocolViolationException.class, () -> stream.push(Chunk.of("late")));
        ExecutionException e = assertThrows(ExecutionException.class, () -> stream.whenEnded().get(5, TimeUnit.SECONDS));
        assertSame(boom, e.getCause());
    }

    @Test
    void testDestroyWithoutError() {
        ReadableStream stream = new ReadableStream();
        stream.destroy();
        assertEquals(ReadableState.DESTROYED, stream.getReadableState());
        assertThrows(CancellationException.class, () -> stream.whenEnded().get(5, TimeUnit.SECONDS));
        // terminal streams ignore pause/resume
        stream.resume();
        assertEquals(ReadableState.DESTROYED, stream.getReadableState());
    }

    @Test
    void testPullsFromSourceAndClosesIt() throws Exception {
        InMemoryChunkSource source = InMemoryChunkSource.of("a", "b", "c");
        ReadableStream stream = new ReadableStream(source, StreamOptions.defaults());
        CountDownLatch closed = new CountDownLatch(1);
        stream.onClose(closed::countDown);
        List<String> received = collect(stream);

        stream.whenEnded().get(5, TimeUnit.SECONDS);
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), received);
        assertTrue(source.isClosed());
        // three chunks and the end of data
        assertEquals(4, source.getRequests());
    }

    @Test
    void testPausedReadRequestsFromSource() throws Exception {
        ReadableStream stream = new ReadableStream(InMemoryChunkSource.of("x"), StreamOptions.defaults());
        CountDownLatch readable = new CountDownLatch(1);
        stream.onReadable(readable::countDown);
        assertNull(stream.read());
        assertTrue(readable.await(5, TimeUnit.SECONDS));
        assertEquals("x", stream.read().asString());
    }

    @Test
    void testSourceFault() {
        IOException failure = new IOException("disk gone");
        ChunkSource failing = new ChunkSource() {
            @Override
            public CompletionStage<Optional<Chunk>> nextChunk() {
                return CompletableFuture.failedFuture(failure);
            }
        };
        ReadableStream stream = new ReadableStream(failing, StreamOptions.defaults());
        stream.onData(chunk -> {
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> stream.whenEnded().get(5, TimeUnit.SECONDS));
        assertInstanceOf(SourceFaultException.class, e.getCause());
        assertSame(failure, e.getCause().getCause());
        assertEquals(ReadableState.ERRORED, stream.getReadableState());
    }

    @Test
    void testHardCapOverrunDestroysStream() {
        ReadableStream stream = new ReadableStream(StreamOptions.builder().highWaterMark(2L).maxBufferedBytes(4).build());
        stream.push(Chunk.of("abc"));
        assertThrows(BackpressureOverrunException.class, () -> stream.push(Chunk.of("de")));
        assertEquals(ReadableState.ERRORED, stream.getReadableState());
        assertThrows(ExecutionException.class, () -> stream.whenEnded().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testThrowingDataListenerDestroysStream() {
        ReadableStream stream = ReadableStream.of(StreamOptions.defaults(), Chunk.of("x"), Chunk.of("y"));
        IllegalArgumentException boom = new IllegalArgumentException("bad chunk");
        stream.onData(chunk -> {
            throw boom;
        });
        ExecutionException e = assertThrows(ExecutionException.class, () -> stream.whenEnded().get(5, TimeUnit.SECONDS));
        assertSame(boom, e.getCause());
    }
}
