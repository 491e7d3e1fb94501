package com.geography.sync.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} backed by a FalkorDB graph through the JFalkorDB client.
 *
 * <p>Parameters are inlined as Cypher literals: {@code $name} placeholders are
 * replaced with quoted and escaped values. Longer names are substituted first
 * so {@code $parentId} is not clobbered by {@code $parent}.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX FOR (c:CanonicalUnit) ON (c.id)",
            "CREATE INDEX FOR (c:CanonicalUnit) ON (c.level)",
            "CREATE INDEX FOR (c:CanonicalUnit) ON (c.parentId)",
            "CREATE INDEX FOR (c:CanonicalUnit) ON (c.normalizedName)",
            "CREATE INDEX FOR (c:CanonicalUnit) ON (c.governmentCode)",
            "CREATE INDEX FOR (t:TenantGeoUnit) ON (t.id)",
            "CREATE INDEX FOR (t:TenantGeoUnit) ON (t.tenantId)",
            "CREATE INDEX FOR (t:TenantGeoUnit) ON (t.canonicalUnitId)",
            "CREATE INDEX FOR (t:TenantGeoUnit) ON (t.parentId)",
            "CREATE INDEX FOR (k:ConflictCase) ON (k.id)",
            "CREATE INDEX FOR (k:ConflictCase) ON (k.status)",
            "CREATE INDEX FOR (e:SyncLedgerEntry) ON (e.sequence)",
            "CREATE INDEX FOR (e:SyncLedgerEntry) ON (e.tenantUnitId)",
            "CREATE INDEX FOR (e:SyncLedgerEntry) ON (e.timestampNanos)"
    );

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String cypher = inline(query, params);
        log.debug("graph.execute {}", cypher);
        graph.query(cypher);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String cypher = inline(query, params);
        log.debug("graph.query {}", cypher);

        ResultSet resultSet = graph.query(cypher);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("graph.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        int created = 0;
        for (String index : INDEXES) {
            try {
                graph.query(index);
                created++;
            } catch (RuntimeException e) {
                // already present
                log.debug("graph.index.skipped query='{}' reason={}", index, e.getMessage());
            }
        }
        log.info("graph.indexes.ready graph={} created={}", graphName, created);
    }

    static String inline(String query, Map<String, Object> params) {
        List<String> names = new ArrayList<>(params.keySet());
        names.sort((a, b) -> Integer.compare(b.length(), a.length()));
        String result = query;
        for (String name : names) {
            result = result.replace("$" + name, literal(params.get(name)));
        }
        return result;
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.close.failed graph={} error={}", graphName, e.getMessage());
        }
        log.info("graph.closed graph={}", graphName);
    }
}
