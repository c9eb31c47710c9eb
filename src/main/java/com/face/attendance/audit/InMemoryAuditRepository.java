package com.face.attendance.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Audit trail kept in memory. Thread-safe.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findBySubjectId(String subjectId) {
        return filter(e -> subjectId.equals(e.subjectId()));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return filter(e -> actorId.equals(e.actorId()));
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> snapshot = new ArrayList<>(entries);
        int size = snapshot.size();
        if (size <= limit) {
            return List.copyOf(snapshot);
        }
        return List.copyOf(snapshot.subList(size - limit, size));
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        return entries.stream().filter(predicate).toList();
    }
}
