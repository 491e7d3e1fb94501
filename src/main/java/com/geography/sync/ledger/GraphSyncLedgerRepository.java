package com.geography.sync.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ledger stored as {@code :SyncLedgerEntry} nodes. The event is kept as a JSON
 * string carrying its {@code kind}, alongside the kind as a plain property for filtering.
 * Timestamps are stored as epoch nanoseconds so range filters compare numerically.
 */
public class GraphSyncLedgerRepository implements SyncLedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphSyncLedgerRepository.class);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final String RETURN_COLUMNS = """
            RETURN e.id AS id, e.sequence AS sequence, e.timestampNanos AS timestampNanos,
                   e.actor AS actor, e.tenantUnitId AS tenantUnitId, e.event AS event
            ORDER BY e.sequence ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphSyncLedgerRepository(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public GraphSyncLedgerRepository(GraphConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    /**
     * Increments the {@code :SyncLedgerSequence} counter node and creates the entry in
     * the same query. FalkorDB runs each write query atomically, so concurrent writers
     * from any process get distinct, gap-free numbers.
     */
    @Override
    public SyncLedgerEntry append(SyncLedgerEntry.Builder draft) {
        Objects.requireNonNull(draft.event, "event is required");
        Map<String, Object> params = new HashMap<>();
        params.put("id", draft.id);
        params.put("timestampNanos", toEpochNanos(draft.timestamp));
        params.put("actor", draft.actor);
        params.put("tenantUnitId", draft.tenantUnitId != null ? draft.tenantUnitId : "");
        params.put("kind", draft.event.getClass().getSimpleName());
        params.put("event", toJson(draft.event));
        List<Map<String, Object>> rows = connection.query("""
                MERGE (s:SyncLedgerSequence {name: 'ledger'})
                ON CREATE SET s.value = 0
                SET s.value = s.value + 1
                CREATE (e:SyncLedgerEntry {
                    id: $id,
                    sequence: s.value,
                    timestampNanos: $timestampNanos,
                    actor: $actor,
                    tenantUnitId: $tenantUnitId,
                    kind: $kind,
                    event: $event
                })
                RETURN e.sequence AS sequence
                """, params);
        if (rows.isEmpty() || rows.get(0).get("sequence") == null) {
            throw new SyncPersistenceException("Ledger append returned no sequence for entry " + draft.id, null);
        }
        SyncLedgerEntry entry = draft.sequence(((Number) rows.get(0).get("sequence")).longValue()).build();
        log.debug("ledger.persisted sequence={} outcome={}", entry.sequence(), entry.outcome());
        return entry;
    }

    @Override
    public List<SyncLedgerEntry> findAll() {
        return map(connection.query("MATCH (e:SyncLedgerEntry)\n" + RETURN_COLUMNS));
    }

    @Override
    public List<SyncLedgerEntry> findByTenantUnitId(String tenantUnitId) {
        return map(connection.query("MATCH (e:SyncLedgerEntry {tenantUnitId: $tenantUnitId})\n" + RETURN_COLUMNS,
                Map.of("tenantUnitId", tenantUnitId)));
    }

    @Override
    public List<SyncLedgerEntry> findSince(Instant since) {
        return map(connection.query("MATCH (e:SyncLedgerEntry)\nWHERE e.timestampNanos >= $since\n" + RETURN_COLUMNS,
                Map.of("since", toEpochNanos(since))));
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (e:SyncLedgerEntry) RETURN count(e) AS cnt");
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).longValue();
    }

    private List<SyncLedgerEntry> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toEntry).toList();
    }

    private SyncLedgerEntry toEntry(Map<String, Object> row) {
        String tenantUnitId = (String) row.get("tenantUnitId");
        return new SyncLedgerEntry(
                (String) row.get("id"),
                ((Number) row.get("sequence")).longValue(),
                fromEpochNanos(((Number) row.get("timestampNanos")).longValue()),
                (String) row.get("actor"),
                tenantUnitId == null || tenantUnitId.isEmpty() ? null : tenantUnitId,
                fromJson((String) row.get("event")));
    }

    static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    private String toJson(SyncEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Cannot serialize ledger event " + event.outcome(), e);
        }
    }

    private SyncEvent fromJson(String json) {
        try {
            return objectMapper.readValue(json, SyncEvent.class);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Corrupt ledger event: " + json, e);
        }
    }
}
