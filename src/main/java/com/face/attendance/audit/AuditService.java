package com.face.attendance.audit;

import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.store.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records the audit trail of submissions, enrollments and attendance writes.
 *
 * <p>Audit failures are logged and never fail the operation being audited; the
 * attendance rows are the source of truth.</p>
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build();
        try {
            repository.save(entry);
            log.debug("audit.recorded action={} subjectId={} actorId={}", action, subjectId, actorId);
        } catch (RuntimeException e) {
            log.error("audit.save.failed action={} subjectId={} error={}", action, subjectId, e.getMessage(), e);
        }
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId) {
        return record(action, subjectId, actorId, null);
    }

    /**
     * Records the rows a submission inserted or upgraded. Unchanged rows are not audited.
     */
    public void recordWrites(String submissionId, String actorId,
                             List<AttendanceRecord> records, List<WriteOutcome> outcomes) {
        for (int i = 0; i < records.size() && i < outcomes.size(); i++) {
            WriteOutcome outcome = outcomes.get(i);
            if (outcome == WriteOutcome.UNCHANGED) {
                continue;
            }
            AttendanceRecord record = records.get(i);
            Map<String, Object> details = new HashMap<>();
            details.put("submissionId", submissionId);
            details.put("status", record.getStatus().name());
            details.put("method", record.getMethod().name());
            if (record.getConfidenceScore() != null) {
                details.put("confidenceScore", record.getConfidenceScore());
            }
            AuditAction action = outcome == WriteOutcome.INSERTED
                    ? AuditAction.ATTENDANCE_INSERTED : AuditAction.ATTENDANCE_UPGRADED;
            record(action, subjectOf(record), actorId, details);
        }
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public int size() {
        return repository.count();
    }

    public static String subjectOf(AttendanceRecord record) {
        return record.getClassId() + "/" + record.getIdentityId() + "/" + record.getDate();
    }
}
