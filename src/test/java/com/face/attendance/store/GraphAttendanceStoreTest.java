package com.face.attendance.store;

import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.testing.RecordingGraphConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphAttendanceStore")
class GraphAttendanceStoreTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 6);

    private static AttendanceRecord record(String identityId, AttendanceStatus status) {
        AttendanceMethod method = status == AttendanceStatus.PRESENT ? AttendanceMethod.FACE_MATCH : AttendanceMethod.MANUAL;
        return AttendanceRecord.builder()
                .classId("c1").identityId(identityId).date(DATE)
                .status(status).method(method)
                .confidenceScore(method == AttendanceMethod.FACE_MATCH ? 0.75 : null)
                .markedBy("system")
                .createdAt(Instant.parse("2024-05-06T09:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("A batch is sent as one query and outcomes are mapped back by index")
    @SuppressWarnings("unchecked")
    void applyAllSingleQuery() {
        RecordingGraphConnection connection = new RecordingGraphConnection().respondWith((q, p) -> List.of(
                Map.of("idx", 1L, "outcome", "UNCHANGED"),
                Map.of("idx", 0L, "outcome", "UPGRADED")));
        GraphAttendanceStore store = new GraphAttendanceStore(connection);

        List<WriteOutcome> outcomes = store.applyAll("c1", DATE, List.of(
                record("a", AttendanceStatus.PRESENT), record("b", AttendanceStatus.ABSENT)));

        assertEquals(List.of(WriteOutcome.UPGRADED, WriteOutcome.UNCHANGED), outcomes);
        assertEquals(1, connection.calls().size());
        assertEquals(GraphAttendanceStore.APPLY_BATCH, connection.lastCall().query());

        List<Map<String, Object>> rows = (List<Map<String, Object>>) connection.lastCall().params().get("rows");
        assertEquals(2, rows.size());
        assertEquals("2024-05-06", rows.get(0).get("date"));
        assertEquals("FACE_MATCH", rows.get(0).get("method"));
        assertNull(rows.get(1).get("confidenceScore"));
    }

    @Test
    @DisplayName("A missing outcome from the graph is an error")
    void missingOutcome() {
        RecordingGraphConnection connection = new RecordingGraphConnection()
                .respondWith((q, p) -> List.of(Map.of("idx", 0L, "outcome", "INSERTED")));
        GraphAttendanceStore store = new GraphAttendanceStore(connection);

        assertThrows(IllegalStateException.class, () -> store.applyAll("c1", DATE, List.of(
                record("a", AttendanceStatus.PRESENT), record("b", AttendanceStatus.ABSENT))));
    }

    @Test
    @DisplayName("An empty batch does not touch the graph")
    void emptyBatch() {
        RecordingGraphConnection connection = new RecordingGraphConnection();

        assertTrue(new GraphAttendanceStore(connection).applyAll("c1", DATE, List.of()).isEmpty());
        assertTrue(connection.calls().isEmpty());
    }

    @Test
    @DisplayName("Rows read back are turned into records")
    void fromRow() {
        Map<String, Object> row = new HashMap<>();
        row.put("classId", "c1");
        row.put("identityId", "a");
        row.put("date", "2024-05-06");
        row.put("status", "PRESENT");
        row.put("method", "FACE_MATCH");
        row.put("confidenceScore", 0.81);
        row.put("markedBy", "system");
        row.put("createdAt", "2024-05-06T09:00:00Z");
        RecordingGraphConnection connection = new RecordingGraphConnection().respondWith((q, p) -> List.of(row));

        List<AttendanceRecord> records = new GraphAttendanceStore(connection).findBySession("c1", DATE);

        AttendanceRecord record = records.get(0);
        assertEquals(DATE, record.getDate());
        assertEquals(AttendanceStatus.PRESENT, record.getStatus());
        assertEquals(0.81, record.getConfidenceScore());
        assertEquals(Instant.parse("2024-05-06T09:00:00Z"), record.getCreatedAt());
        assertEquals("2024-05-06", connection.lastCall().params().get("date"));
    }

    @Test
    @DisplayName("The batch query upgrades only ABSENT rows by face match")
    void batchQueryEncodesPolicy() {
        assertTrue(GraphAttendanceStore.APPLY_BATCH.contains(
                "previousStatus = 'ABSENT' AND row.status = 'PRESENT' AND row.method = 'FACE_MATCH'"));
        assertTrue(GraphAttendanceStore.APPLY_BATCH.startsWith("UNWIND $rows"));
    }
}
