package com.face.attendance.store;

import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.graph.GraphConnection;
import com.face.attendance.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attendance rows stored in FalkorDB as {@code (:Attendance)} nodes keyed by
 * classId, identityId and ISO date.
 *
 * <p>A batch is sent as one {@code UNWIND ... MERGE} query, which FalkorDB runs
 * atomically. The query applies the same rule as
 * {@link com.face.attendance.decision.AttendanceConflictPolicy}: an existing ABSENT row
 * is upgraded by a PRESENT face match, any other existing row is left unchanged.</p>
 */
public class GraphAttendanceStore implements AttendanceStore {
    private static final Logger log = LoggerFactory.getLogger(GraphAttendanceStore.class);

    static final String APPLY_BATCH = """
            UNWIND $rows AS row
            OPTIONAL MATCH (existing:Attendance {classId: row.classId, identityId: row.identityId, date: row.date})
            WITH row, existing.status AS previousStatus
            MERGE (a:Attendance {classId: row.classId, identityId: row.identityId, date: row.date})
            ON CREATE SET a.status = row.status, a.method = row.method,
                          a.confidenceScore = row.confidenceScore, a.markedBy = row.markedBy,
                          a.createdAt = row.createdAt
            WITH row, a, CASE
                WHEN previousStatus IS NULL THEN 'INSERTED'
                WHEN previousStatus = 'ABSENT' AND row.status = 'PRESENT' AND row.method = 'FACE_MATCH' THEN 'UPGRADED'
                ELSE 'UNCHANGED' END AS outcome
            FOREACH (ignored IN CASE WHEN outcome = 'UPGRADED' THEN [1] ELSE [] END |
                SET a.status = row.status, a.method = row.method,
                    a.confidenceScore = row.confidenceScore, a.markedBy = row.markedBy)
            RETURN row.idx AS idx, outcome
            """;

    private static final String RETURN_ROW = """
            RETURN a.classId AS classId, a.identityId AS identityId, a.date AS date,
                   a.status AS status, a.method AS method, a.confidenceScore AS confidenceScore,
                   a.markedBy AS markedBy, a.createdAt AS createdAt
            """;

    private final GraphConnection connection;

    public GraphAttendanceStore(GraphConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection is required");
    }

    @Override
    public List<WriteOutcome> applyAll(String classId, LocalDate date, List<AttendanceRecord> records) {
        InputSanitizer.validateIdentifier("classId", classId);
        Objects.requireNonNull(date, "date is required");
        if (records.isEmpty()) {
            return List.of();
        }

        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            AttendanceRecord record = records.get(i);
            if (!record.getClassId().equals(classId) || !record.getDate().equals(date)) {
                throw new IllegalArgumentException("Record " + record.key()
                        + " does not belong to session " + classId + "/" + date);
            }
            InputSanitizer.validateIdentifier("identityId", record.getIdentityId());
            InputSanitizer.sanitizeForCypher(record.getMarkedBy());
            rows.add(toParams(i, record));
        }

        List<Map<String, Object>> results = connection.query(APPLY_BATCH, Map.of("rows", rows));

        WriteOutcome[] outcomes = new WriteOutcome[records.size()];
        for (Map<String, Object> result : results) {
            Object idx = result.get("idx");
            Object outcome = result.get("outcome");
            if (idx instanceof Number n && outcome != null) {
                outcomes[n.intValue()] = WriteOutcome.valueOf(outcome.toString());
            }
        }
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] == null) {
                throw new IllegalStateException("Graph did not report an outcome for " + records.get(i).key());
            }
        }
        log.debug("attendance.batch.applied classId={} date={} rows={}", classId, date, records.size());
        return Arrays.asList(outcomes);
    }

    @Override
    public List<AttendanceRecord> findBySession(String classId, LocalDate date) {
        return read("MATCH (a:Attendance {classId: $classId, date: $date}) " + RETURN_ROW
                        + " ORDER BY identityId",
                Map.of("classId", classId, "date", date.toString()));
    }

    @Override
    public List<AttendanceRecord> findByClass(String classId) {
        return read("MATCH (a:Attendance {classId: $classId}) " + RETURN_ROW
                        + " ORDER BY date, identityId",
                Map.of("classId", classId));
    }

    @Override
    public List<AttendanceRecord> findByIdentity(String identityId) {
        return read("MATCH (a:Attendance {identityId: $identityId}) " + RETURN_ROW
                        + " ORDER BY date, classId",
                Map.of("identityId", identityId));
    }

    @Override
    public boolean isAvailable() {
        return connection.isConnected();
    }

    private List<AttendanceRecord> read(String cypher, Map<String, Object> params) {
        List<AttendanceRecord> records = new ArrayList<>();
        for (Map<String, Object> row : connection.query(cypher, params)) {
            records.add(fromRow(row));
        }
        return records;
    }

    private static Map<String, Object> toParams(int idx, AttendanceRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("idx", idx);
        row.put("classId", record.getClassId());
        row.put("identityId", record.getIdentityId());
        row.put("date", record.getDate().toString());
        row.put("status", record.getStatus().name());
        row.put("method", record.getMethod().name());
        row.put("confidenceScore", record.getConfidenceScore());
        row.put("markedBy", record.getMarkedBy());
        row.put("createdAt", record.getCreatedAt().toString());
        return row;
    }

    static AttendanceRecord fromRow(Map<String, Object> row) {
        Map<String, Object> values = new HashMap<>(row);
        Object confidence = values.get("confidenceScore");
        Object markedBy = values.get("markedBy");
        Object createdAt = values.get("createdAt");
        return AttendanceRecord.builder()
                .classId(String.valueOf(values.get("classId")))
                .identityId(String.valueOf(values.get("identityId")))
                .date(LocalDate.parse(String.valueOf(values.get("date"))))
                .status(AttendanceStatus.valueOf(String.valueOf(values.get("status"))))
                .method(AttendanceMethod.valueOf(String.valueOf(values.get("method"))))
                .confidenceScore(confidence instanceof Number n ? n.doubleValue() : null)
                .markedBy(markedBy != null ? markedBy.toString() : null)
                .createdAt(createdAt != null ? Instant.parse(createdAt.toString()) : null)
                .build();
    }
}
