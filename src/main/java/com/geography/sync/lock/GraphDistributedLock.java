package com.geography.sync.lock;

import com.geography.sync.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Advisory lock shared by several JVMs through a {@code :ScopeLock} node.
 *
 * <p>An atomic MERGE acts as check-and-set. {@code expiresAt} is epoch
 * milliseconds. A node whose lease has passed is taken over by the next
 * caller, so a crashed owner blocks a scope for at most the lease TTL.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private static final String ACQUIRE = """
            MERGE (l:ScopeLock {key: $key})
            ON CREATE SET l.owner = $owner, l.expiresAt = $expiresAt
            ON MATCH SET l.owner = CASE WHEN l.expiresAt < $now THEN $owner ELSE l.owner END,
                         l.expiresAt = CASE WHEN l.expiresAt < $now THEN $expiresAt ELSE l.expiresAt END
            RETURN l.owner AS owner
            """;

    private static final String RELEASE = """
            MATCH (l:ScopeLock {key: $key, owner: $owner})
            DELETE l
            """;

    private final GraphConnection connection;
    private final LockConfig config;
    private final String ownerId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this.connection = connection;
        this.config = config;
        this.ownerId = ProcessHandle.current().pid() + "-" + System.nanoTime();
        try {
            connection.execute("CREATE INDEX FOR (l:ScopeLock) ON (l.key)");
        } catch (RuntimeException e) {
            log.debug("lock.index.skipped reason={}", e.getMessage());
        }
    }

    @Override
    public boolean tryLock(String key) {
        int attempts = config.graphAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt(key)) {
                log.debug("lock.acquired key={} attempt={}", key, attempt);
                return true;
            }
            if (attempt < attempts) {
                sleep(key);
            }
        }
        throw new LockAcquisitionException("Lock '" + key + "' still held after " + attempts + " attempts");
    }

    @Override
    public void unlock(String key) {
        try {
            connection.execute(RELEASE, Map.of("key", key, "owner", ownerId));
            log.debug("lock.released key={}", key);
        } catch (RuntimeException e) {
            // the TTL reclaims the node if this delete is lost
            log.warn("lock.release.failed key={} error={}", key, e.getMessage());
        }
    }

    String getOwnerId() {
        return ownerId;
    }

    private boolean attempt(String key) {
        Instant now = Instant.now();
        try {
            List<Map<String, Object>> rows = connection.query(ACQUIRE, Map.of(
                    "key", key,
                    "owner", ownerId,
                    "now", now.toEpochMilli(),
                    "expiresAt", now.plus(config.graphLeaseTtl()).toEpochMilli()));
            return !rows.isEmpty() && ownerId.equals(rows.get(0).get("owner"));
        } catch (RuntimeException e) {
            log.warn("lock.attempt.failed key={} error={}", key, e.getMessage());
            return false;
        }
    }

    private void sleep(String key) {
        try {
            Thread.sleep(config.graphRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock '" + key + "'", e);
        }
    }
}
