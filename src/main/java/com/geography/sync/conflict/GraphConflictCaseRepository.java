package com.geography.sync.conflict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geography.sync.api.Page;
import com.geography.sync.api.PageRequest;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.graph.GraphConnection;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conflict cases stored as {@code :ConflictCase} nodes.
 *
 * <p>Candidates are a JSON array. Their ids are also kept in a {@code |id|id|}
 * delimited string so a case can be found by candidate with {@code CONTAINS}.
 * Resolution fields are flattened onto the node and empty while the case is open.</p>
 */
public class GraphConflictCaseRepository implements ConflictCaseRepository {
    private static final TypeReference<List<MatchCandidate>> CANDIDATES = new TypeReference<>() {};

    private static final String COLUMNS = """
            RETURN k.id AS id, k.tenantUnitId AS tenantUnitId, k.tenantId AS tenantId, k.level AS level,
                   k.declaredName AS declaredName, k.candidates AS candidates, k.status AS status,
                   k.action AS action, k.canonicalId AS canonicalId, k.resolvedBy AS resolvedBy,
                   k.notes AS notes, k.resolvedAt AS resolvedAt, k.openedAt AS openedAt
            ORDER BY k.openedAt ASC, k.id ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GraphConflictCaseRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void save(ConflictCase conflictCase) {
        ConflictResolution resolution = conflictCase.getResolution();
        Map<String, Object> params = new HashMap<>();
        params.put("id", conflictCase.getId());
        params.put("tenantUnitId", conflictCase.getTenantUnitId());
        params.put("tenantId", conflictCase.getTenantId());
        params.put("level", conflictCase.getLevel());
        params.put("declaredName", conflictCase.getDeclaredName());
        params.put("candidates", toJson(conflictCase.getCandidates()));
        params.put("candidateIds", "|" + String.join("|", conflictCase.getCandidateIds()) + "|");
        params.put("status", conflictCase.getStatus().name());
        params.put("action", resolution != null ? resolution.action().name() : "");
        params.put("canonicalId", resolution != null && resolution.canonicalId() != null ? resolution.canonicalId() : "");
        params.put("resolvedBy", resolution != null ? resolution.resolvedBy() : "");
        params.put("notes", resolution != null && resolution.notes() != null ? resolution.notes() : "");
        params.put("resolvedAt", resolution != null ? resolution.resolvedAt().toString() : "");
        params.put("openedAt", conflictCase.getOpenedAt().toString());
        connection.execute("""
                MERGE (k:ConflictCase {id: $id})
                SET k.tenantUnitId = $tenantUnitId, k.tenantId = $tenantId, k.level = $level,
                    k.declaredName = $declaredName, k.candidates = $candidates, k.candidateIds = $candidateIds,
                    k.status = $status, k.action = $action, k.canonicalId = $canonicalId,
                    k.resolvedBy = $resolvedBy, k.notes = $notes, k.resolvedAt = $resolvedAt,
                    k.openedAt = $openedAt
                """, params);
    }

    @Override
    public void delete(String caseId) {
        connection.execute("MATCH (k:ConflictCase {id: $id}) DELETE k", Map.of("id", caseId));
    }

    @Override
    public Optional<ConflictCase> findById(String caseId) {
        return map(connection.query("MATCH (k:ConflictCase {id: $id})\n" + COLUMNS, Map.of("id", caseId)))
                .stream().findFirst();
    }

    @Override
    public Page<ConflictCase> findOpen(PageRequest request) {
        long total = count("MATCH (k:ConflictCase {status: 'OPEN'}) RETURN count(k) AS cnt", Map.of());
        List<ConflictCase> content = map(connection.query(
                "MATCH (k:ConflictCase {status: 'OPEN'})\n" + COLUMNS + "SKIP $offset LIMIT $limit",
                Map.of("offset", request.offset(), "limit", request.limit())));
        return new Page<>(content, total, request.pageNumber(), request.limit());
    }

    @Override
    public Page<ConflictCase> findOpenByTenant(String tenantId, PageRequest request) {
        long total = count("MATCH (k:ConflictCase {status: 'OPEN', tenantId: $tenantId}) RETURN count(k) AS cnt",
                Map.of("tenantId", tenantId));
        List<ConflictCase> content = map(connection.query(
                "MATCH (k:ConflictCase {status: 'OPEN', tenantId: $tenantId})\n" + COLUMNS + "SKIP $offset LIMIT $limit",
                Map.of("tenantId", tenantId, "offset", request.offset(), "limit", request.limit())));
        return new Page<>(content, total, request.pageNumber(), request.limit());
    }

    @Override
    public Optional<ConflictCase> findOpenByTenantUnit(String tenantUnitId) {
        return map(connection.query("MATCH (k:ConflictCase {status: 'OPEN', tenantUnitId: $tenantUnitId})\n" + COLUMNS,
                Map.of("tenantUnitId", tenantUnitId))).stream().findFirst();
    }

    @Override
    public List<ConflictCase> findOpenByCandidate(String canonicalId) {
        return map(connection.query("""
                MATCH (k:ConflictCase {status: 'OPEN'})
                WHERE k.candidateIds CONTAINS $needle
                """ + COLUMNS, Map.of("needle", "|" + canonicalId + "|")));
    }

    @Override
    public long countOpen() {
        return count("MATCH (k:ConflictCase {status: 'OPEN'}) RETURN count(k) AS cnt", Map.of());
    }

    private long count(String query, Map<String, Object> params) {
        List<Map<String, Object>> rows = connection.query(query, params);
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).longValue();
    }

    private List<ConflictCase> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toCase).toList();
    }

    private ConflictCase toCase(Map<String, Object> row) {
        ConflictStatus status = ConflictStatus.valueOf((String) row.get("status"));
        ConflictResolution resolution = null;
        if (status == ConflictStatus.RESOLVED) {
            resolution = new ConflictResolution(
                    ResolutionAction.valueOf((String) row.get("action")),
                    emptyToNull(row.get("canonicalId")),
                    (String) row.get("resolvedBy"),
                    emptyToNull(row.get("notes")),
                    Instant.parse((String) row.get("resolvedAt")));
        }
        return ConflictCase.builder()
                .id((String) row.get("id"))
                .tenantUnitId((String) row.get("tenantUnitId"))
                .tenantId((String) row.get("tenantId"))
                .level(((Number) row.get("level")).intValue())
                .declaredName((String) row.get("declaredName"))
                .candidates(fromJson((String) row.get("candidates")))
                .status(status)
                .resolution(resolution)
                .openedAt(Instant.parse((String) row.get("openedAt")))
                .build();
    }

    private String toJson(List<MatchCandidate> candidates) {
        try {
            return objectMapper.writeValueAsString(candidates);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Cannot serialize conflict candidates", e);
        }
    }

    private List<MatchCandidate> fromJson(String json) {
        try {
            return objectMapper.readValue(json, CANDIDATES);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Corrupt conflict candidates: " + json, e);
        }
    }

    private static String emptyToNull(Object value) {
        return value instanceof String s && !s.isEmpty() ? s : null;
    }
}
