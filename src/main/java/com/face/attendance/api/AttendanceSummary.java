package com.face.attendance.api;

/**
 * Attendance totals of one class across all its sessions.
 *
 * @param totalStudents    identities on the class roster
 * @param totalSessions    distinct dates with at least one row
 * @param presentRecords   rows with status PRESENT
 * @param absentRecords    rows with status ABSENT
 * @param lateRecords      rows with status LATE
 * @param faceMatchRecords rows produced by a face match
 */
public record AttendanceSummary(
        String classId,
        int totalStudents,
        int totalSessions,
        long presentRecords,
        long absentRecords,
        long lateRecords,
        long faceMatchRecords
) {

    /**
     * Share of rows counting as attended (PRESENT or LATE), 0 when there are none.
     */
    public double attendanceRate() {
        long total = presentRecords + absentRecords + lateRecords;
        return total == 0 ? 0.0 : (double) (presentRecords + lateRecords) / total;
    }
}
