package com.face.attendance.store;

/**
 * What applying one attendance record did to the stored row for its key.
 */
public enum WriteOutcome {
    /** No row existed; the record was stored. */
    INSERTED,
    /** An existing row was changed by the conflict policy. */
    UPGRADED,
    /** An existing row was kept as is. */
    UNCHANGED
}
