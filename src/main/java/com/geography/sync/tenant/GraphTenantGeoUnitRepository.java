package com.geography.sync.tenant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.graph.GraphConnection;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tenant units stored as {@code :TenantGeoUnit} nodes, with the
 * language-to-name map kept as a JSON object.
 */
public class GraphTenantGeoUnitRepository implements TenantGeoUnitRepository {
    private static final TypeReference<LinkedHashMap<String, String>> NAMES = new TypeReference<>() {};

    private static final String COLUMNS = """
            RETURN t.id AS id, t.tenantId AS tenantId, t.level AS level, t.parentId AS parentId,
                   t.names AS names, t.primaryLanguage AS primaryLanguage, t.governmentCode AS governmentCode,
                   t.canonicalUnitId AS canonicalUnitId, t.syncState AS syncState, t.retired AS retired,
                   t.createdAt AS createdAt, t.updatedAt AS updatedAt
            ORDER BY t.createdAt ASC
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GraphTenantGeoUnitRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void save(TenantGeoUnit unit) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", unit.getId());
        params.put("tenantId", unit.getTenantId());
        params.put("level", unit.getLevel());
        params.put("parentId", nullToEmpty(unit.getParentId()));
        params.put("names", toJson(unit.getNames()));
        params.put("primaryLanguage", unit.getPrimaryLanguage());
        params.put("governmentCode", nullToEmpty(unit.getGovernmentCode()));
        params.put("canonicalUnitId", nullToEmpty(unit.getCanonicalUnitId()));
        params.put("syncState", unit.getSyncState().name());
        params.put("retired", unit.isRetired());
        params.put("createdAt", unit.getCreatedAt().toString());
        params.put("updatedAt", unit.getUpdatedAt().toString());
        connection.execute("""
                MERGE (t:TenantGeoUnit {id: $id})
                SET t.tenantId = $tenantId, t.level = $level, t.parentId = $parentId, t.names = $names,
                    t.primaryLanguage = $primaryLanguage, t.governmentCode = $governmentCode,
                    t.canonicalUnitId = $canonicalUnitId, t.syncState = $syncState, t.retired = $retired,
                    t.createdAt = $createdAt, t.updatedAt = $updatedAt
                """, params);
    }

    @Override
    public Optional<TenantGeoUnit> findById(String id) {
        return map(connection.query("MATCH (t:TenantGeoUnit {id: $id})\n" + COLUMNS, Map.of("id", id)))
                .stream().findFirst();
    }

    @Override
    public List<TenantGeoUnit> findByTenant(String tenantId) {
        return map(connection.query("MATCH (t:TenantGeoUnit {tenantId: $tenantId})\n" + COLUMNS,
                Map.of("tenantId", tenantId)));
    }

    @Override
    public List<TenantGeoUnit> findSiblings(String tenantId, int level, String parentId) {
        return map(connection.query(
                "MATCH (t:TenantGeoUnit {tenantId: $tenantId, level: $level, parentId: $parentId})\n" + COLUMNS,
                Map.of("tenantId", tenantId, "level", level, "parentId", nullToEmpty(parentId))));
    }

    @Override
    public List<TenantGeoUnit> findChildren(String parentId) {
        return map(connection.query("MATCH (t:TenantGeoUnit {parentId: $parentId})\n" + COLUMNS,
                Map.of("parentId", parentId)));
    }

    @Override
    public List<TenantGeoUnit> findByCanonicalUnitId(String canonicalUnitId) {
        return map(connection.query("MATCH (t:TenantGeoUnit {canonicalUnitId: $canonicalUnitId})\n" + COLUMNS,
                Map.of("canonicalUnitId", canonicalUnitId)));
    }

    @Override
    public long count() {
        List<Map<String, Object>> rows = connection.query("MATCH (t:TenantGeoUnit) RETURN count(t) AS cnt");
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("cnt")).longValue();
    }

    private List<TenantGeoUnit> map(List<Map<String, Object>> rows) {
        return rows.stream().map(this::toUnit).toList();
    }

    private TenantGeoUnit toUnit(Map<String, Object> row) {
        return TenantGeoUnit.builder()
                .id((String) row.get("id"))
                .tenantId((String) row.get("tenantId"))
                .level(((Number) row.get("level")).intValue())
                .parentId(emptyToNull(row.get("parentId")))
                .names(fromJson((String) row.get("names")))
                .primaryLanguage((String) row.get("primaryLanguage"))
                .governmentCode(emptyToNull(row.get("governmentCode")))
                .canonicalUnitId(emptyToNull(row.get("canonicalUnitId")))
                .syncState(SyncState.valueOf((String) row.get("syncState")))
                .retired(Boolean.TRUE.equals(row.get("retired")))
                .createdAt(Instant.parse((String) row.get("createdAt")))
                .updatedAt(Instant.parse((String) row.get("updatedAt")))
                .build();
    }

    private String toJson(Map<String, String> names) {
        try {
            return objectMapper.writeValueAsString(names);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Cannot serialize declared names", e);
        }
    }

    private Map<String, String> fromJson(String json) {
        try {
            return objectMapper.readValue(json, NAMES);
        } catch (JsonProcessingException e) {
            throw new SyncPersistenceException("Corrupt declared names: " + json, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(Object value) {
        return value instanceof String s && !s.isEmpty() ? s : null;
    }
}
