package io.chunkstreams.server.core;

import io.chunkstreams.core.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the open observer connections of every stream key.
 *
 * <p>Used for lifecycle bookkeeping and bulk close; chunks never flow through it.
 */
public final class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<StreamKey, Set<StreamConnection>> connections = new ConcurrentHashMap<>();

    public void addConnection(StreamKey key, StreamConnection connection) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(connection, "connection");
        connections.compute(key, (k, set) -> {
            Set<StreamConnection> target = set != null ? set : ConcurrentHashMap.newKeySet();
            target.add(connection);
            return target;
        });
        log.debug("Connection added: stream={}, connections={}", key, connectionCount(key));
    }

    /**
     * Remove a connection. Removing one that is not registered is a no-op.
     *
     * @return whether the connection was registered
     */
    public boolean removeConnection(StreamKey key, StreamConnection connection) {
        boolean[] removed = new boolean[1];
        connections.computeIfPresent(key, (k, set) -> {
            removed[0] = set.remove(connection);
            return set.isEmpty() ? null : set;
        });
        if (removed[0] && !connections.containsKey(key)) {
            log.debug("All connections removed: stream={}", key);
        }
        return removed[0];
    }

    public int connectionCount(StreamKey key) {
        Set<StreamConnection> set = connections.get(key);
        return set == null ? 0 : set.size();
    }

    public int totalConnections() {
        int total = 0;
        for (Set<StreamConnection> set : connections.values()) {
            total += set.size();
        }
        return total;
    }

    /**
     * Snapshot of the connections currently open for a key.
     */
    public Set<StreamConnection> connections(StreamKey key) {
        Set<StreamConnection> set = connections.get(key);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    /**
     * End every connection of a key with the end-of-stream sentinel.
     */
    public void closeConnections(StreamKey key) {
        Set<StreamConnection> snapshot = connections(key);
        snapshot.forEach(StreamConnection::finish);
        log.info("Closing all connections: stream={}, connections={}", key, snapshot.size());
    }

    /**
     * Close every connection of every key without a sentinel. Used on shutdown.
     */
    public void closeAll() {
        List<StreamConnection> snapshot = new ArrayList<>();
        connections.values().forEach(snapshot::addAll);
        snapshot.forEach(StreamConnection::close);
        if (!snapshot.isEmpty()) {
            log.info("Closed all connections: count={}", snapshot.size());
        }
    }
}
