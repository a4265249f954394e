package io.chunkstreams.client;

import io.chunkstreams.core.Chunk;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Rebuilds application state from a chunk stream.
 *
 * <p>Every {@link StreamEvent.Connected} resets the state to the initial value, since the replay
 * that follows is authoritative. Every chunk is folded through the reducer function in stream
 * order.
 *
 * <pre>{@code
 * ChunkStateReducer<List<Chunk>> messages = new ChunkStateReducer<>(List.of(), (list, chunk) -> {
 *     List<Chunk> next = new ArrayList<>(list);
 *     next.add(chunk);
 *     return next;
 * });
 * client.subscribe(StreamRequest.of(url, "report.pdf")).subscribe(messages);
 * }</pre>
 *
 * @param <S> state type; treat it as immutable, as it is read from other threads
 */
public final class ChunkStateReducer<S> implements Flow.Subscriber<StreamEvent> {

    private final S initial;
    private final BiFunction<S, Chunk, S> reducer;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile S state;
    private volatile int connections;
    private volatile boolean done;
    private volatile Throwable error;
    private volatile Flow.Subscription subscription;

    public ChunkStateReducer(S initial, BiFunction<S, Chunk, S> reducer) {
        this.initial = initial;
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.state = initial;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(StreamEvent event) {
        if (event instanceof StreamEvent.Connected) {
            state = initial;
            connections++;
        } else if (event instanceof StreamEvent.Data data) {
            state = reducer.apply(state, data.chunk());
        } else if (event instanceof StreamEvent.Done) {
            done = true;
        }
    }

    @Override
    public void onError(Throwable throwable) {
        error = throwable;
        terminated.countDown();
    }

    @Override
    public void onComplete() {
        terminated.countDown();
    }

    public S state() {
        return state;
    }

    /** Number of connections seen so far, reconnects included. */
    public int connections() {
        return connections;
    }

    /** Whether the server ended the stream with its end-of-stream sentinel. */
    public boolean isDone() {
        return done;
    }

    public Throwable error() {
        return error;
    }

    /** Stops following the stream. */
    public void cancel() {
        Flow.Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
