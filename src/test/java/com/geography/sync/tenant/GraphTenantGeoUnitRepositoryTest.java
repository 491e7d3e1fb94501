package com.geography.sync.tenant;

import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.graph.GraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphTenantGeoUnitRepositoryTest {

    private StubGraphConnection connection;
    private GraphTenantGeoUnitRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphTenantGeoUnitRepository(connection);
    }

    @Test
    @DisplayName("save upserts by id with names as a JSON object")
    void saveMergesNode() {
        TenantGeoUnit unit = TenantGeoUnit.builder()
                .id("tu-1").tenantId("tenant-a").level(1).parentId("tu-0")
                .name("en", "Kathmandu").name("ne", "काठमाडौं")
                .build();
        unit.transitionTo(SyncState.PENDING_SYNC);

        repository.save(unit);

        assertTrue(connection.executedQueries.get(0).startsWith("MERGE (t:TenantGeoUnit {id: $id})"));
        Map<String, Object> params = connection.executedParams.get(0);
        assertEquals("{\"en\":\"Kathmandu\",\"ne\":\"काठमाडौं\"}", params.get("names"));
        assertEquals("en", params.get("primaryLanguage"));
        assertEquals("", params.get("canonicalUnitId"));
        assertEquals("PENDING_SYNC", params.get("syncState"));
        assertEquals(false, params.get("retired"));
    }

    @Test
    @DisplayName("rows map back with declared names in order")
    void mapsRows() {
        connection.queryResults = List.of(row());

        TenantGeoUnit unit = repository.findById("tu-1").orElseThrow();

        assertEquals("tenant-b", unit.getTenantId());
        assertEquals(2, unit.getLevel());
        assertEquals("Naya Road", unit.getDeclaredName());
        assertEquals(List.of("en", "ne"), new ArrayList<>(unit.getNames().keySet()));
        assertEquals("c9", unit.getCanonicalUnitId());
        assertEquals(SyncState.SYNCED, unit.getSyncState());
        assertTrue(unit.isRetired());
        assertNull(unit.getGovernmentCode());
    }

    @Test
    @DisplayName("findSiblings scopes by tenant, level and parent")
    void findSiblingsScope() {
        repository.findSiblings("tenant-a", 0, null);

        Map<String, Object> params = connection.queryParams.get(0);
        assertEquals("tenant-a", params.get("tenantId"));
        assertEquals(0, params.get("level"));
        assertEquals("", params.get("parentId"));
    }

    @Test
    @DisplayName("count reads the cnt column")
    void countsNodes() {
        connection.queryResults = List.of(Map.of("cnt", 3L));

        assertEquals(3, repository.count());
    }

    private static Map<String, Object> row() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", "tu-1");
        row.put("tenantId", "tenant-b");
        row.put("level", 2L);
        row.put("parentId", "tu-0");
        row.put("names", "{\"en\":\"Naya Road\",\"ne\":\"नयाँ सडक\"}");
        row.put("primaryLanguage", "en");
        row.put("governmentCode", "");
        row.put("canonicalUnitId", "c9");
        row.put("syncState", "SYNCED");
        row.put("retired", true);
        row.put("createdAt", "2026-02-01T00:00:00Z");
        row.put("updatedAt", "2026-02-01T00:00:00Z");
        return row;
    }

    private static class StubGraphConnection implements GraphConnection {
        final List<String> executedQueries = new ArrayList<>();
        final List<Map<String, Object>> executedParams = new ArrayList<>();
        final List<Map<String, Object>> queryParams = new ArrayList<>();
        List<Map<String, Object>> queryResults = List.of();

        @Override
        public void execute(String query, Map<String, Object> params) {
            executedQueries.add(query);
            executedParams.add(params);
        }

        @Override
        public List<Map<String, Object>> query(String query, Map<String, Object> params) {
            queryParams.add(params);
            return queryResults;
        }

        @Override
        public boolean isConnected() {
            return true;
        }

        @Override
        public String getGraphName() {
            return "test";
        }

        @Override
        public void createIndexes() {
        }

        @Override
        public void close() {
        }
    }
}
