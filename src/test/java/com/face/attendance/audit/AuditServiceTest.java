package com.face.attendance.audit;

import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.store.WriteOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("AuditService")
class AuditServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 9, 2);

    private AuditService service;

    @BeforeEach
    void setUp() {
        service = new AuditService(new InMemoryAuditRepository());
    }

    private static AttendanceRecord present(String identityId, double score) {
        return AttendanceRecord.builder()
                .classId("bio-101").identityId(identityId).date(DAY)
                .status(AttendanceStatus.PRESENT).method(AttendanceMethod.FACE_MATCH)
                .confidenceScore(score).markedBy("instructor-1")
                .build();
    }

    @Test
    @DisplayName("Inserted and upgraded rows are audited, unchanged rows are not")
    void recordWrites() {
        List<AttendanceRecord> records = List.of(present("a", 0.82), present("b", 0.7), present("c", 0.65));
        List<WriteOutcome> outcomes = List.of(WriteOutcome.INSERTED, WriteOutcome.UNCHANGED, WriteOutcome.UPGRADED);

        service.recordWrites("sub-1", "instructor-1", records, outcomes);

        assertEquals(2, service.size());
        AuditEntry inserted = service.getEntriesByAction(AuditAction.ATTENDANCE_INSERTED).get(0);
        assertEquals("bio-101/a/2024-09-02", inserted.subjectId());
        assertEquals("sub-1", inserted.details().get("submissionId"));
        assertEquals(0.82, inserted.details().get("confidenceScore"));
        assertEquals(1, service.getEntriesByAction(AuditAction.ATTENDANCE_UPGRADED).size());
        assertTrue(service.getEntriesForSubject("bio-101/b/2024-09-02").isEmpty());
    }

    @Test
    @DisplayName("Entries can be looked up by actor and recency")
    void queries() {
        service.record(AuditAction.SIGNATURE_ENROLLED, "alice", "admin");
        service.record(AuditAction.SIGNATURE_REMOVED, "bob", "admin");
        service.record(AuditAction.SUBMISSION_COMPLETED, "sub-9", "instructor-2", Map.of("facesDetected", 3));

        assertEquals(2, service.getEntriesByActor("admin").size());
        List<AuditEntry> recent = service.getRecentEntries(2);
        assertEquals(List.of(AuditAction.SIGNATURE_REMOVED, AuditAction.SUBMISSION_COMPLETED),
                recent.stream().map(AuditEntry::action).toList());
        assertEquals(3, service.getAllEntries().size());
    }

    @Test
    @DisplayName("A failing repository never fails the audited operation")
    void repositoryFailure() {
        AuditRepository broken = mock(AuditRepository.class);
        when(broken.save(any())).thenThrow(new IllegalStateException("disk full"));
        AuditService failing = new AuditService(broken);

        AuditEntry entry = assertDoesNotThrow(() -> failing.record(AuditAction.SUBMISSION_FAILED, "sub-2", null));

        assertEquals(AuditAction.SUBMISSION_FAILED, entry.action());
        verify(broken).save(entry);
    }

    @Test
    @DisplayName("Entry details cannot be modified")
    void detailsImmutable() {
        AuditEntry entry = service.record(AuditAction.ENROLLMENT_FAILED, "carol", "admin", Map.of("reason", "no face"));

        assertThrows(UnsupportedOperationException.class, () -> entry.details().put("x", 1));
    }
}
