package com.geography.sync.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.UnitStatus;
import com.geography.sync.core.model.VerificationState;
import com.geography.sync.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical units stored as {@code :CanonicalUnit} nodes. Name and tenant sets
 * are kept as JSON arrays; a missing parent is stored as the empty string so
 * it can take part in equality matches.
 *
 * <p>The unique key is checked before each write. Callers hold the scope lock
 * for the key they write, which makes the check-then-write atomic.</p>
 */
public class GraphCanonicalUnitRepository implements CanonicalUnitRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphCanonicalUnitRepository.class);
    private static final TypeReference<LinkedHashSet<String>> STRING_SET = new TypeReference<>() {};

    private static final String COLUMNS = """
            RETURN c.id AS id, c.level AS level, c.parentId AS parentId, c.primaryName AS primaryName,
                   c.normalizedName AS normalizedName, c.alternateNames AS alternateNames,
                   c.tenantIds AS tenantIds, c.governmentCode AS governmentCode,
                   c.verificationState AS verificationState, c.status AS status,
                   c.mergedInto AS mergedInto, c.createdAt AS createdAt, c.updatedAt AS updatedAt
            ORDER BY c.createdAt ASC, c.id ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphCanonicalUnitRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public CanonicalUnit insert(CanonicalUnit unit) {
        if (unit.isActive()) {
            checkKeyFree(unit);
        }
        connection.execute("""
                CREATE (c:CanonicalUnit {
                    id: $id, level: $level, parentId: $parentId, primaryName: $primaryName,
                    normalizedName: $normalizedName, alternateNames: $alternateNames, tenantIds: $tenantIds,
                    governmentCode: $governmentCode, verificationState: $verificationState, status: $status,
                    mergedInto: $mergedInto, createdAt: $createdAt, updatedAt: $updatedAt
                })
                """, params(unit));
        log.debug("canonical.persisted id={} level={}", unit.getId(), unit.getLevel());
        return unit.copy();
    }

    @Override
    public void update(CanonicalUnit unit) {
        if (findById(unit.getId()).isEmpty()) {
            throw new UnknownUnitException("Canonical unit", unit.getId());
        }
        if (unit.isActive()) {
            checkKeyFree(unit);
        }
        connection.execute("""
                MATCH (c:CanonicalUnit {id: $id})
                SET c.parentId = $parentId, c.primaryName = $primaryName, c.normalizedName = $normalizedName,
                    c.alternateNames = $alternateNames, c.tenantIds = $tenantIds,
                    c.governmentCode = $governmentCode, c.verificationState = $verificationState,
                    c.status = $status, c.mergedInto = $mergedInto, c.updatedAt = $updatedAt
                """, params(unit));
    }

    @Override
    public void delete(String id) {
        connection.execute("MATCH (c:CanonicalUnit {id: $id}) DELETE c", Map.of("id", id));
    }

    @Override
    public Optional<CanonicalUnit> findById(String id) {
        List<CanonicalUnit> found = map(connection.query(
                "MATCH (c:CanonicalUnit {id: $id})\n" + COLUMNS, Map.of("id", id)));
        return found.stream().findFirst();
    }

    @Override
    public List<CanonicalUnit> findActive(int level, String parentId) {
        return map(connection.query(
                "MATCH (c:CanonicalUnit {level: $level, parentId: $parentId, status: 'ACTIVE'})\n" + COLUMNS,
                Map.of("level", level, "parentId", nullToEmpty(parentId))));
    }

    @Override
    public Optional<CanonicalUnit> findActiveByKey(int level, String parentId, String normalizedName) {
        return map(connection.query("""
                MATCH (c:CanonicalUnit {level: $level, parentId: $parentId, normalizedName: $normalizedName, status: 'ACTIVE'})
                """ + COLUMNS,
                Map.of("level", level, "parentId", nullToEmpty(parentId), "normalizedName", normalizedName)))
                .stream().findFirst();
    }

    @Override
    public List<CanonicalUnit> findChildren(String parentId) {
        return map(connection.query(
                "MATCH (c:CanonicalUnit {parentId: $parentId, status: 'ACTIVE'})\n" + COLUMNS,
                Map.of("parentId", parentId)));
    }

    @Override
    public List<CanonicalUnit> findAll() {
        return map(connection.query("MATCH (c:CanonicalUnit)\n" + COLUMNS));
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (c:CanonicalUnit) RETURN count(c) AS cnt");
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).longValue();
    }

    private void checkKeyFree(CanonicalUnit unit) {
        findActiveByKey(unit.getLevel(), unit.getParentId(), unit.getNormalizedName())
                .filter(existing -> !existing.getId().equals(unit.getId()))
                .ifPresent(existing -> {
                    throw new DuplicateCanonicalUnitException(
                            unit.getLevel(), unit.getParentId(), unit.getNormalizedName());
                });
    }

    private Map<String, Object> params(CanonicalUnit unit) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", unit.getId());
        params.put("level", unit.getLevel());
        params.put("parentId", nullToEmpty(unit.getParentId()));
        params.put("primaryName", unit.getPrimaryName());
        params.put("normalizedName", unit.getNormalizedName());
        params.put("alternateNames", toJson(unit.getAlternateNames()));
        params.put("tenantIds", toJson(unit.getTenantIds()));
        params.put("governmentCode", nullToEmpty(unit.getGovernmentCode()));
        params.put("verificationState", unit.getVerificationState().name());
        params.put("status", unit.getStatus().name());
        params.put("mergedInto", nullToEmpty(unit.getMergedInto()));
        params.put("createdAt", unit.getCreatedAt().toString());
        params.put("updatedAt", unit.getUpdatedAt().toString());
        return params;
    }

    private List<CanonicalUnit> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toUnit).toList();
    }

    private CanonicalUnit toUnit(Map<String, Object> row) {
        return CanonicalUnit.builder()
                .id((String) row.get("id"))
                .level(((Number) row.get("level")).intValue())
                .parentId(emptyToNull(row.get("parentId")))
                .primaryName((String) row.get("primaryName"))
                .normalizedName((String) row.get("normalizedName"))
                .alternateNames(fromJson((String) row.get("alternateNames")))
                .tenantIds(fromJson((String) row.get("tenantIds")))
                .governmentCode(emptyToNull(row.get("governmentCode")))
                .verificationState(VerificationState.valueOf((String) row.get("verificationState")))
                .status(UnitStatus.valueOf((String) row.get("status")))
                .mergedInto(emptyToNull(row.get("mergedInto")))
                .createdAt(Instant.parse((String) row.get("createdAt")))
                .updatedAt(Instant.parse((String) row.get("updatedAt")))
                .build();
    }

    private String toJson(Set<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Cannot serialize name set", e);
        }
    }

    private Set<String> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Set.of();
        }
        try {
            return objectMapper.readValue(json, STRING_SET);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Corrupt name set: " + json, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(Object value) {
        return value instanceof String s && !s.isEmpty() ? s : null;
    }
}
