package com.face.attendance.store;

import com.face.attendance.core.model.AttendanceRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistent attendance rows, unique on (classId, identityId, date).
 */
public interface AttendanceStore {

    /**
     * Applies a batch of records for one class and date as a single atomic step.
     * Each record is inserted when its key is new; otherwise the conflict policy
     * decides whether the stored row is upgraded or left alone. Either every
     * record of the batch is applied or none is.
     *
     * @return one outcome per record, in input order
     * @throws IllegalArgumentException if a record belongs to another class or date
     */
    List<WriteOutcome> applyAll(String classId, LocalDate date, List<AttendanceRecord> records);

    /**
     * Rows for one class on one day, ordered by identity id.
     */
    List<AttendanceRecord> findBySession(String classId, LocalDate date);

    /**
     * Every row of a class, ordered by date then identity id.
     */
    List<AttendanceRecord> findByClass(String classId);

    /**
     * Every row of an identity across classes, ordered by date then class id.
     */
    List<AttendanceRecord> findByIdentity(String identityId);

    default boolean isAvailable() {
        return true;
    }
}
