package com.geography.sync.conflict;

import com.geography.sync.api.Page;
import com.geography.sync.api.PageRequest;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.graph.GraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphConflictCaseRepositoryTest {

    private StubGraphConnection connection;
    private GraphConflictCaseRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphConflictCaseRepository(connection);
    }

    @Test
    @DisplayName("open cases are saved with empty resolution fields")
    void saveOpenCase() {
        repository.save(openCase());

        assertTrue(connection.executedQueries.get(0).contains("MERGE (k:ConflictCase {id: $id})"));
        Map<String, Object> params = connection.executedParams.get(0);
        assertEquals("OPEN", params.get("status"));
        assertEquals("|c1|c2|", params.get("candidateIds"));
        assertEquals("", params.get("action"));
        assertEquals("", params.get("resolvedAt"));
        assertTrue(((String) params.get("candidates")).contains("\"canonicalId\":\"c1\""));
    }

    @Test
    @DisplayName("resolved cases carry the resolution")
    void saveResolvedCase() {
        ConflictCase conflictCase = openCase();
        conflictCase.resolve(new ConflictResolution(ResolutionAction.LINK, "c2", "steward",
                null, Instant.parse("2026-04-01T00:00:00Z")));

        repository.save(conflictCase);

        Map<String, Object> params = connection.executedParams.get(0);
        assertEquals("RESOLVED", params.get("status"));
        assertEquals("LINK", params.get("action"));
        assertEquals("c2", params.get("canonicalId"));
        assertEquals("", params.get("notes"));
    }

    @Test
    @DisplayName("rows read back as cases with candidates and resolution")
    void mapsRows() {
        repository.save(openCase());
        Map<String, Object> row = rowFromWrite();
        row.put("status", "RESOLVED");
        row.put("action", "REJECT");
        row.put("resolvedBy", "steward");
        row.put("notes", "not a street");
        row.put("resolvedAt", "2026-04-02T00:00:00Z");
        connection.queryResults = List.of(row);

        ConflictCase found = repository.findById("case-1").orElseThrow();

        assertEquals(ConflictStatus.RESOLVED, found.getStatus());
        assertEquals(List.of("c1", "c2"), found.getCandidateIds());
        assertEquals(0.65, found.getCandidates().get(0).score(), 1e-9);
        assertEquals(ResolutionAction.REJECT, found.getResolution().action());
        assertNull(found.getResolution().canonicalId());
        assertEquals("not a street", found.getResolution().notes());
    }

    @Test
    @DisplayName("open rows have no resolution")
    void openRowHasNoResolution() {
        repository.save(openCase());
        connection.queryResults = List.of(rowFromWrite());

        ConflictCase found = repository.findOpenByTenantUnit("tu-9").orElseThrow();

        assertTrue(found.isOpen());
        assertNull(found.getResolution());
        assertEquals("tu-9", connection.queryParams.get(0).get("tenantUnitId"));
    }

    @Test
    @DisplayName("candidate lookup searches the delimited id string")
    void findByCandidateUsesDelimiters() {
        repository.findOpenByCandidate("c1");

        assertEquals("|c1|", connection.queryParams.get(0).get("needle"));
    }

    @Test
    @DisplayName("paged listing passes offset and limit")
    void pagedListing() {
        connection.queryResults = List.of();

        Page<ConflictCase> page = repository.findOpen(PageRequest.of(2, 10));

        assertEquals(0, page.totalElements());
        Map<String, Object> listParams = connection.queryParams.get(1);
        assertEquals(20, listParams.get("offset"));
        assertEquals(10, listParams.get("limit"));
    }

    private static ConflictCase openCase() {
        return ConflictCase.builder()
                .id("case-1")
                .tenantUnitId("tu-9")
                .tenantId("tenant-b")
                .level(2)
                .declaredName("Naya Road")
                .candidates(List.of(new MatchCandidate("c1", "Naya Sadak", 0.65),
                        new MatchCandidate("c2", "New Road", 0.59)))
                .openedAt(Instant.parse("2026-03-01T00:00:00Z"))
                .build();
    }

    private Map<String, Object> rowFromWrite() {
        Map<String, Object> row = new HashMap<>(connection.executedParams.get(0));
        row.remove("candidateIds");
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
