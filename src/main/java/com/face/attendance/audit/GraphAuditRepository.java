package com.face.attendance.audit;

import com.face.attendance.graph.GraphConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit trail persisted as {@code (:AuditEntry)} nodes. Details are stored as a JSON string.
 */
public class GraphAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAuditRepository.class);

    private static final String RETURN_ENTRY = """
            RETURN a.id AS id, a.action AS action, a.subjectId AS subjectId,
                   a.actorId AS actorId, a.details AS details, a.timestamp AS timestamp
            """;

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphAuditRepository(GraphConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        connection.execute("""
                CREATE (a:AuditEntry {
                    id: $id,
                    action: $action,
                    subjectId: $subjectId,
                    actorId: $actorId,
                    details: $details,
                    timestamp: $timestamp
                })
                """, Map.of(
                "id", entry.id(),
                "action", entry.action().name(),
                "subjectId", entry.subjectId() != null ? entry.subjectId() : "",
                "actorId", entry.actorId() != null ? entry.actorId() : "",
                "details", serializeDetails(entry.details()),
                "timestamp", entry.timestamp().toString()));
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return read("MATCH (a:AuditEntry) " + RETURN_ENTRY + " ORDER BY timestamp ASC", Map.of());
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return read("MATCH (a:AuditEntry {subjectId: $subjectId}) " + RETURN_ENTRY + " ORDER BY timestamp ASC",
                Map.of("subjectId", subjectId));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return read("MATCH (a:AuditEntry {action: $action}) " + RETURN_ENTRY + " ORDER BY timestamp ASC",
                Map.of("action", action.name()));
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return read("MATCH (a:AuditEntry {actorId: $actorId}) " + RETURN_ENTRY + " ORDER BY timestamp ASC",
                Map.of("actorId", actorId));
    }

    @Override
    public int count() {
        List<Map<String, Object>> rows = connection.query("MATCH (a:AuditEntry) RETURN count(a) AS cnt");
        if (rows.isEmpty() || !(rows.get(0).get("cnt") instanceof Number n)) {
            return 0;
        }
        return n.intValue();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> newestFirst = read("MATCH (a:AuditEntry) " + RETURN_ENTRY
                + " ORDER BY timestamp DESC LIMIT $limit", Map.of("limit", limit));
        List<AuditEntry> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    private List<AuditEntry> read(String cypher, Map<String, Object> params) {
        return connection.query(cypher, params).stream().map(this::toEntry).toList();
    }

    private AuditEntry toEntry(Map<String, Object> row) {
        String subjectId = (String) row.get("subjectId");
        String actorId = (String) row.get("actorId");
        String timestamp = (String) row.get("timestamp");
        return new AuditEntry(
                (String) row.get("id"),
                AuditAction.valueOf((String) row.get("action")),
                subjectId != null && !subjectId.isEmpty() ? subjectId : null,
                actorId != null && !actorId.isEmpty() ? actorId : null,
                deserializeDetails((String) row.get("details")),
                timestamp != null ? Instant.parse(timestamp) : Instant.EPOCH);
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("audit.details.unserializable error={}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("audit.details.unreadable error={}", e.getMessage());
            return Map.of();
        }
    }
}
