package com.face.attendance.audit;

import java.util.List;

/**
 * Append-only storage for {@link AuditEntry}s. All finders return entries oldest first.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    int count();

    /**
     * The newest {@code limit} entries, still oldest first.
     */
    List<AuditEntry> findRecent(int limit);
}
