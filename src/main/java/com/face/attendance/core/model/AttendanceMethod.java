package com.face.attendance.core.model;

/**
 * How an attendance record was produced.
 */
public enum AttendanceMethod {
    /** Entered by a person, or inferred absent by the engine. */
    MANUAL,

    /** Produced by a face match against an enrolled signature. */
    FACE_MATCH
}
