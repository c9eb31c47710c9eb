package com.face.attendance.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FalkorDB implementation using the JFalkorDB client.
 *
 * <p>Parameters are inlined into the query text. Strings are quoted and escaped,
 * collections become Cypher lists and maps become Cypher map literals, so a whole
 * attendance batch can be passed to a single {@code UNWIND}.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = inlineParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = inlineParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for face attendance...");
        createIndexQuietly("CREATE INDEX FOR (s:FaceSignature) ON (s.identityId)");
        createIndexQuietly("CREATE INDEX FOR (a:Attendance) ON (a.classId)");
        createIndexQuietly("CREATE INDEX FOR (a:Attendance) ON (a.identityId)");
        createIndexQuietly("CREATE INDEX FOR (a:Attendance) ON (a.date)");
        createIndexQuietly("CREATE INDEX FOR (a:AuditEntry) ON (a.subjectId)");
        log.info("Index creation complete");
    }

    private void createIndexQuietly(String query) {
        try {
            graph.query(query);
        } catch (RuntimeException e) {
            // FalkorDB rejects CREATE INDEX when the index already exists
            log.debug("Index creation skipped: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders in one pass. Inlined values are never
     * rescanned, and placeholders without a parameter are left as they are.
     */
    static String inlineParams(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                    ? formatValue(params.get(name))
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof float[] floats) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < floats.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(floats[i]);
            }
            return sb.append(']').toString();
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<?> it = collection.iterator();
            while (it.hasNext()) {
                sb.append(formatValue(it.next()));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                String key = String.valueOf(entry.getKey());
                InputSanitizer.validatePropertyKey(key);
                sb.append(key).append(": ").append(formatValue(entry.getValue()));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append('}').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}
