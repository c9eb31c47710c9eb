package com.face.attendance.decision;

import com.face.attendance.core.model.AttendanceMethod;
import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.AttendanceStatus;
import com.face.attendance.store.WriteOutcome;

import java.util.Objects;

/**
 * Decides what happens when a record is written for a key that already has a row.
 *
 * <p>A face match may lift an existing ABSENT row to PRESENT. Nothing else
 * changes an existing row: PRESENT and LATE are never downgraded, and a manual
 * status always beats an inferred absence.</p>
 */
public class AttendanceConflictPolicy {

    /**
     * The row to keep and how it relates to the existing one.
     */
    public record Resolution(AttendanceRecord record, WriteOutcome outcome) {}

    /**
     * @param existing the stored row, or null if the key is new
     * @param incoming the row this submission wants to write
     */
    public Resolution resolve(AttendanceRecord existing, AttendanceRecord incoming) {
        Objects.requireNonNull(incoming, "incoming is required");
        if (existing == null) {
            return new Resolution(incoming, WriteOutcome.INSERTED);
        }
        if (!existing.key().equals(incoming.key())) {
            throw new IllegalArgumentException("Records have different keys: "
                    + existing.key() + " vs " + incoming.key());
        }
        if (isUpgrade(existing, incoming)) {
            AttendanceRecord upgraded = incoming.toBuilder()
                    .createdAt(existing.getCreatedAt())
                    .build();
            return new Resolution(upgraded, WriteOutcome.UPGRADED);
        }
        return new Resolution(existing, WriteOutcome.UNCHANGED);
    }

    public boolean isUpgrade(AttendanceRecord existing, AttendanceRecord incoming) {
        return existing.getStatus() == AttendanceStatus.ABSENT
                && incoming.getStatus() == AttendanceStatus.PRESENT
                && incoming.getMethod() == AttendanceMethod.FACE_MATCH;
    }
}
