package com.face.attendance.store;

import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.decision.AttendanceConflictPolicy;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attendance rows held in memory, grouped per (class, date) session.
 * A batch is applied inside one {@code compute} on its session, so concurrent
 * submissions for the same session serialize and never see half a batch.
 */
public class InMemoryAttendanceStore implements AttendanceStore {

    private static final Comparator<AttendanceRecord> BY_DATE_THEN_IDS =
            Comparator.comparing(AttendanceRecord::getDate)
                    .thenComparing(AttendanceRecord::getClassId)
                    .thenComparing(AttendanceRecord::getIdentityId);

    private final Map<SessionKey, Map<String, AttendanceRecord>> sessions = new ConcurrentHashMap<>();
    private final AttendanceConflictPolicy conflictPolicy;

    public InMemoryAttendanceStore() {
        this(new AttendanceConflictPolicy());
    }

    public InMemoryAttendanceStore(AttendanceConflictPolicy conflictPolicy) {
        this.conflictPolicy = Objects.requireNonNull(conflictPolicy, "conflictPolicy is required");
    }

    @Override
    public List<WriteOutcome> applyAll(String classId, LocalDate date, List<AttendanceRecord> records) {
        SessionKey key = new SessionKey(classId, date);
        for (AttendanceRecord record : records) {
            checkSession(key, record);
        }
        List<WriteOutcome> outcomes = new ArrayList<>(records.size());
        sessions.compute(key, (k, current) -> {
            // work on a copy so a failure leaves the stored session untouched
            Map<String, AttendanceRecord> next = current == null ? new HashMap<>() : new HashMap<>(current);
            List<WriteOutcome> batch = new ArrayList<>(records.size());
            for (AttendanceRecord record : records) {
                AttendanceConflictPolicy.Resolution resolution =
                        conflictPolicy.resolve(next.get(record.getIdentityId()), record);
                next.put(record.getIdentityId(), resolution.record());
                batch.add(resolution.outcome());
            }
            outcomes.addAll(batch);
            return Map.copyOf(next);
        });
        return outcomes;
    }

    @Override
    public List<AttendanceRecord> findBySession(String classId, LocalDate date) {
        Map<String, AttendanceRecord> session = sessions.get(new SessionKey(classId, date));
        if (session == null) {
            return List.of();
        }
        return sorted(session.values());
    }

    @Override
    public List<AttendanceRecord> findByClass(String classId) {
        List<AttendanceRecord> rows = new ArrayList<>();
        sessions.forEach((key, session) -> {
            if (key.classId().equals(classId)) {
                rows.addAll(session.values());
            }
        });
        return sorted(rows);
    }

    @Override
    public List<AttendanceRecord> findByIdentity(String identityId) {
        List<AttendanceRecord> rows = new ArrayList<>();
        for (Map<String, AttendanceRecord> session : sessions.values()) {
            AttendanceRecord row = session.get(identityId);
            if (row != null) {
                rows.add(row);
            }
        }
        return sorted(rows);
    }

    public int size() {
        return sessions.values().stream().mapToInt(Map::size).sum();
    }

    private static List<AttendanceRecord> sorted(Collection<AttendanceRecord> rows) {
        List<AttendanceRecord> list = new ArrayList<>(rows);
        list.sort(BY_DATE_THEN_IDS);
        return list;
    }

    private static void checkSession(SessionKey key, AttendanceRecord record) {
        Objects.requireNonNull(record, "record is required");
        if (!record.getClassId().equals(key.classId()) || !record.getDate().equals(key.date())) {
            throw new IllegalArgumentException("Record " + record.key()
                    + " does not belong to session " + key.classId() + "/" + key.date());
        }
    }

    private record SessionKey(String classId, LocalDate date) {
        SessionKey {
            Objects.requireNonNull(classId, "classId is required");
            Objects.requireNonNull(date, "date is required");
        }
    }
}
