package io.chunkstreams.server.core;

import io.chunkstreams.core.StreamKey;
import io.chunkstreams.server.spi.ChunkListener;
import io.chunkstreams.server.spi.LogEntry;
import io.chunkstreams.server.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide publish/subscribe multiplexer keyed by stream.
 *
 * <p>Holds no history: a listener only sees entries emitted while it is registered. Entries are
 * delivered synchronously on the emitting thread, to listeners in registration order. One
 * instance is shared by reference between the producer side and every stream endpoint.
 */
public final class ChunkBus {

    private static final Logger log = LoggerFactory.getLogger(ChunkBus.class);

    private final ConcurrentHashMap<StreamKey, CopyOnWriteArrayList<Registration>> listeners = new ConcurrentHashMap<>();

    /**
     * Register a listener for a key.
     *
     * @return handle that removes exactly this registration
     */
    public Subscription addListener(StreamKey key, ChunkListener listener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(key, listener);
        listeners.compute(key, (k, list) -> {
            CopyOnWriteArrayList<Registration> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(registration);
            return target;
        });
        return registration;
    }

    /**
     * Deliver an entry to every listener currently registered for the key.
     *
     * <p>A listener that throws is logged and skipped; the remaining listeners still receive the entry.
     */
    public void emit(StreamKey key, LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        List<Registration> registrations = listeners.get(key);
        if (registrations == null) {
            return;
        }
        for (Registration registration : registrations) {
            if (registration.cancelled.get()) continue;
            try {
                registration.listener.onEntry(entry);
            } catch (RuntimeException e) {
                log.warn("Listener failed: stream={}, seq={}", key, entry.seq(), e);
            }
        }
    }

    public int listenerCount(StreamKey key) {
        List<Registration> registrations = listeners.get(key);
        return registrations == null ? 0 : registrations.size();
    }

    /**
     * Drop every registration for a key and tell each listener through {@link ChunkListener#onRemoved()}.
     * Their handles become no-ops.
     */
    public void removeAllListeners(StreamKey key) {
        List<Registration> removed = listeners.remove(key);
        if (removed == null) {
            return;
        }
        for (Registration registration : removed) {
            if (!registration.cancelled.compareAndSet(false, true)) continue;
            try {
                registration.listener.onRemoved();
            } catch (RuntimeException e) {
                log.warn("Listener failed on removal: stream={}", key, e);
            }
        }
        log.debug("Removed all listeners: stream={}, count={}", key, removed.size());
    }

    private final class Registration implements Subscription {
        private final StreamKey key;
        private final ChunkListener listener;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Registration(StreamKey key, ChunkListener listener) {
            this.key = key;
            this.listener = listener;
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            listeners.computeIfPresent(key, (k, list) -> {
                list.remove(this);
                return list.isEmpty() ? null : list;
            });
        }
    }
}
