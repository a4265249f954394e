package io.chunkstreams.server.core;

import io.chunkstreams.core.SseFrame;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.server.spi.ChunkListener;
import io.chunkstreams.server.spi.ChunkLog;
import io.chunkstreams.server.spi.LogEntry;
import io.chunkstreams.server.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One observer connection: replays the stream's history, then forwards live entries.
 *
 * <p>The live listener is registered before the log is read. Entries emitted while the replay runs
 * are buffered in a bounded inbox and dropped on delivery when their sequence number was already
 * replayed. A sequence number that skips ahead, or an inbox overflow, is repaired by reading the log
 * after the last delivered entry. The observer therefore receives every entry exactly once and in
 * log order.
 *
 * <p>A finish request is served once the inbox is empty: entries queued before it, and any the log
 * holds beyond the last delivered one, go out ahead of the end-of-stream sentinel.
 *
 * <p>All frames and the terminal signal are sent from the session's own task. Teardown can be
 * requested from any thread; its bookkeeping runs at most once.
 */
final class StreamSession implements Flow.Subscription, StreamConnection, Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);
    private static final AtomicLong IDS = new AtomicLong();

    private enum Work { FINISH, RESYNC, KEEP_ALIVE, ENTRY }

    private final long id = IDS.incrementAndGet();
    private final StreamKey key;
    private final ChunkLog chunkLog;
    private final ChunkBus bus;
    private final ConnectionRegistry registry;
    private final Flow.Subscriber<? super SseFrame> subscriber;
    private final int maxPending;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    // guarded by lock
    private final ArrayDeque<LogEntry> inbox = new ArrayDeque<>();
    private long demand;
    private boolean overflowed;
    private boolean keepAliveDue;
    private boolean finishRequested;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Throwable failure;
    private volatile Subscription busSubscription;
    private volatile ScheduledFuture<?> keepAliveTask;

    // written by the session task only
    private volatile long lastDelivered;
    private LogEntry pending;

    StreamSession(StreamKey key, ChunkLog chunkLog, ChunkBus bus, ConnectionRegistry registry,
                  Flow.Subscriber<? super SseFrame> subscriber, int maxPending) {
        this.key = Objects.requireNonNull(key, "key");
        this.chunkLog = Objects.requireNonNull(chunkLog, "chunkLog");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.maxPending = maxPending;
    }

    @Override
    public StreamKey key() {
        return key;
    }

    long id() {
        return id;
    }

    boolean isClosed() {
        return closed.get();
    }

    void keepAliveTask(ScheduledFuture<?> task) {
        keepAliveTask = task;
        if (closed.get()) {
            task.cancel(false);
        }
    }

    @Override
    public void run() {
        try {
            if (closed.get()) {
                return;
            }
            registry.addConnection(key, this);
            if (closed.get()) {
                registry.removeConnection(key, this);
                return;
            }
            busSubscription = bus.addListener(key, new ChunkListener() {
                @Override
                public void onEntry(LogEntry entry) {
                    enqueue(entry);
                }

                @Override
                public void onRemoved() {
                    log.info("Live feed removed, closing: stream={}, session={}", key, id);
                    close();
                }
            });
            if (closed.get()) {
                busSubscription.cancel();
                return;
            }
            log.info("Stream session opened: stream={}, session={}", key, id);

            if (!emit(SseFrame.comment("connected " + key))) return;
            if (!replay(chunkLog.read(key))) return;
            log.info("Replayed history: stream={}, session={}, chunks={}", key, id, lastDelivered);

            while (!closed.get()) {
                Work work = nextWork();
                if (work == null) break;
                switch (work) {
                    case FINISH -> {
                        // the inbox is drained; pick up anything recorded but never emitted
                        if (replay(chunkLog.readAfter(key, lastDelivered))) {
                            emit(SseFrame.done());
                        }
                        teardown(null);
                    }
                    case RESYNC -> {
                        log.warn("Inbox overflow, resyncing from log: stream={}, session={}, after={}", key, id, lastDelivered);
                        replay(chunkLog.readAfter(key, lastDelivered));
                    }
                    case KEEP_ALIVE -> emit(SseFrame.keepAlive());
                    case ENTRY -> deliverLive(pending);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            teardown(e);
        } catch (Throwable t) {
            log.error("Stream session failed: stream={}, session={}", key, id, t);
            teardown(t);
        } finally {
            teardown(null);
            signalTerminal();
        }
    }

    /**
     * Bus callback, runs on the producer's thread. Never blocks beyond the inbox lock.
     */
    private void enqueue(LogEntry entry) {
        lock.lock();
        try {
            if (closed.get()) return;
            if (inbox.size() >= maxPending) {
                overflowed = true;
                inbox.clear();
            } else {
                inbox.add(entry);
            }
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void markKeepAliveDue() {
        lock.lock();
        try {
            keepAliveDue = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private Work nextWork() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (closed.get()) return null;
                if (overflowed) {
                    overflowed = false;
                    inbox.clear();
                    return Work.RESYNC;
                }
                if (keepAliveDue) {
                    keepAliveDue = false;
                    return Work.KEEP_ALIVE;
                }
                LogEntry next = inbox.poll();
                if (next != null) {
                    pending = next;
                    return Work.ENTRY;
                }
                if (finishRequested) return Work.FINISH;
                wake.await();
            }
        } finally {
            lock.unlock();
        }
    }

    private void deliverLive(LogEntry entry) throws InterruptedException {
        if (entry.seq() <= lastDelivered) {
            return;
        }
        if (entry.seq() > lastDelivered + 1) {
            log.debug("Sequence gap, repairing from log: stream={}, session={}, expected={}, got={}",
                    key, id, lastDelivered + 1, entry.seq());
            if (!replay(chunkLog.readAfter(key, lastDelivered))) return;
            if (entry.seq() <= lastDelivered) return;
        }
        deliver(entry);
    }

    private boolean replay(List<LogEntry> entries) throws InterruptedException {
        for (LogEntry entry : entries) {
            if (entry.seq() <= lastDelivered) continue;
            if (!deliver(entry)) return false;
        }
        return !closed.get();
    }

    private boolean deliver(LogEntry entry) throws InterruptedException {
        if (!emit(SseFrame.data(entry.chunk()))) return false;
        lastDelivered = entry.seq();
        log.debug("Chunk sent: stream={}, session={}, seq={}", key, id, entry.seq());
        return true;
    }

    /**
     * Waits for demand, then hands one frame to the host. Returns false once the session is closed.
     */
    private boolean emit(SseFrame frame) throws InterruptedException {
        lock.lock();
        try {
            while (demand == 0 && !closed.get()) {
                wake.await();
            }
            if (closed.get()) return false;
            demand--;
        } finally {
            lock.unlock();
        }
        try {
            subscriber.onNext(frame);
        } catch (RuntimeException e) {
            log.warn("Delivery failed: stream={}, session={}", key, id, e);
            teardown(null);
            return false;
        }
        return !closed.get();
    }

    @Override
    public void request(long n) {
        if (n <= 0) {
            teardown(new IllegalArgumentException("non-positive request: " + n));
            return;
        }
        lock.lock();
        try {
            long sum = demand + n;
            demand = sum < 0 ? Long.MAX_VALUE : sum;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Host abort: the observer disconnected or a write failed.
     */
    @Override
    public void cancel() {
        teardown(null);
    }

    @Override
    public void finish() {
        lock.lock();
        try {
            finishRequested = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        teardown(null);
    }

    /**
     * Removes the connection, unsubscribes the listener and stops the keep-alive, exactly once.
     */
    void teardown(Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failure = cause;
        registry.removeConnection(key, this);
        Subscription subscription = busSubscription;
        if (subscription != null) {
            subscription.cancel();
        }
        ScheduledFuture<?> task = keepAliveTask;
        if (task != null) {
            task.cancel(false);
        }
        lock.lock();
        try {
            inbox.clear();
            wake.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Stream session closed: stream={}, session={}, delivered={}", key, id, lastDelivered);
    }

    /**
     * Sends onComplete or onError to the host once. Called by the session task, or directly when
     * the task never got to run.
     */
    void signalTerminal() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        Throwable cause = failure;
        try {
            if (cause == null) {
                subscriber.onComplete();
            } else {
                subscriber.onError(cause);
            }
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on terminal signal: stream={}, session={}", key, id, e);
        }
    }
}
