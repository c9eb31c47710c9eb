package com.face.attendance.registry;

import com.face.attendance.core.model.Signature;
import com.face.attendance.graph.GraphConnection;
import com.face.attendance.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry stored in FalkorDB as {@code (:FaceSignature {identityId, embedding})} nodes,
 * searched through a vector index on {@code embedding}.
 */
public class GraphSignatureRegistry implements SignatureRegistry {
    private static final Logger log = LoggerFactory.getLogger(GraphSignatureRegistry.class);

    static final String UPSERT = """
            OPTIONAL MATCH (old:FaceSignature {identityId: $identityId})
            WITH count(old) AS existed
            MERGE (s:FaceSignature {identityId: $identityId})
            SET s.embedding = vecf32($embedding), s.updatedAt = $updatedAt
            RETURN existed
            """;

    static final String QUERY = """
            CALL db.idx.vector.queryNodes('FaceSignature', 'embedding', $topK, vecf32($signature))
            YIELD node, score
            RETURN node.identityId AS identityId, score
            """;

    static final String REMOVE = """
            MATCH (s:FaceSignature {identityId: $identityId})
            DELETE s
            RETURN count(s) AS removed
            """;

    private final GraphConnection connection;
    private final int dimension;
    private final SimilarityMetric metric;

    public GraphSignatureRegistry(GraphConnection connection, int dimension, SimilarityMetric metric) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.metric = Objects.requireNonNull(metric, "metric is required");
    }

    /**
     * Creates the vector index if it does not exist yet.
     */
    public void createVectorIndex() {
        String ddl = "CREATE VECTOR INDEX FOR (s:FaceSignature) ON (s.embedding) "
                + "OPTIONS {dimension: " + dimension + ", similarityFunction: '" + metric.falkorName() + "'}";
        try {
            connection.execute(ddl);
            log.info("registry.index.created dimension={} metric={}", dimension, metric);
        } catch (RuntimeException e) {
            log.debug("registry.index.skipped reason={}", e.getMessage());
        }
    }

    @Override
    public boolean upsert(String identityId, Signature signature) {
        InputSanitizer.validateIdentifier("identityId", identityId);
        checkDimension(signature);
        List<Map<String, Object>> rows = run(UPSERT, Map.of(
                "identityId", identityId,
                "embedding", signature.values(),
                "updatedAt", Instant.now().toString()));
        boolean replaced = !rows.isEmpty() && toLong(rows.get(0).get("existed")) > 0;
        log.debug("registry.upsert identityId={} replaced={}", identityId, replaced);
        return replaced;
    }

    @Override
    public List<RegistryMatch> query(Signature signature, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        checkDimension(signature);
        List<Map<String, Object>> rows = run(QUERY, Map.of("topK", topK, "signature", signature.values()));
        List<RegistryMatch> matches = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object id = row.get("identityId");
            Object score = row.get("score");
            if (id == null || !(score instanceof Number distance)) {
                continue;
            }
            matches.add(new RegistryMatch(id.toString(), metric.fromDistance(distance.doubleValue())));
        }
        matches.sort(RegistryMatch.BEST_FIRST);
        return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
    }

    @Override
    public boolean remove(String identityId) {
        InputSanitizer.validateIdentifier("identityId", identityId);
        List<Map<String, Object>> rows = run(REMOVE, Map.of("identityId", identityId));
        return !rows.isEmpty() && toLong(rows.get(0).get("removed")) > 0;
    }

    @Override
    public boolean contains(String identityId) {
        if (identityId == null || identityId.isBlank()) {
            return false;
        }
        List<Map<String, Object>> rows = run(
                "MATCH (s:FaceSignature {identityId: $identityId}) RETURN count(s) AS c",
                Map.of("identityId", identityId));
        return !rows.isEmpty() && toLong(rows.get(0).get("c")) > 0;
    }

    @Override
    public int size() {
        List<Map<String, Object>> rows = run("MATCH (s:FaceSignature) RETURN count(s) AS c", Map.of());
        return rows.isEmpty() ? 0 : (int) toLong(rows.get(0).get("c"));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public SimilarityMetric metric() {
        return metric;
    }

    @Override
    public boolean isAvailable() {
        return connection.isConnected();
    }

    private List<Map<String, Object>> run(String cypher, Map<String, Object> params) {
        try {
            return connection.query(cypher, params);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RegistryUnavailableException("Signature registry query failed: " + e.getMessage(), e);
        }
    }

    private void checkDimension(Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (signature.dimension() != dimension) {
            throw new IllegalArgumentException("Signature dimension " + signature.dimension()
                    + " does not match registry dimension " + dimension);
        }
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
