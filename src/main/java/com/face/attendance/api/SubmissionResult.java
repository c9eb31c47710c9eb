package com.face.attendance.api;

import com.face.attendance.core.model.AttendanceRecord;
import com.face.attendance.core.model.FaceOutcome;
import com.face.attendance.core.model.UnrecognizedReason;

import java.time.LocalDate;
import java.util.List;

/**
 * Response to a photo submission.
 *
 * <p>On success {@code facesRecognized + facesUnrecognized == facesDetected}, and
 * {@code recognizedStudents} holds no identity and no face index twice. On failure
 * nothing was written and {@link #getErrorCode()} says why.</p>
 */
public final class SubmissionResult {

    /**
     * A face credited to an identity.
     */
    public record RecognizedStudent(String identityId, int faceIndex, double similarityScore) {}

    /**
     * A face nobody was credited for.
     */
    public record UnrecognizedFace(int faceIndex, UnrecognizedReason reason) {}

    private final boolean success;
    private final String submissionId;
    private final String classId;
    private final LocalDate date;
    private final int facesDetected;
    private final List<RecognizedStudent> recognizedStudents;
    private final List<UnrecognizedFace> unrecognizedFaces;
    private final List<FaceOutcome> faceOutcomes;
    private final List<AttendanceRecord> attendanceRecords;
    private final int inserted;
    private final int upgraded;
    private final int unchanged;
    private final String message;
    private final ErrorCode errorCode;

    private SubmissionResult(Builder builder) {
        this.success = builder.success;
        this.submissionId = builder.submissionId;
        this.classId = builder.classId;
        this.date = builder.date;
        this.facesDetected = builder.facesDetected;
        this.recognizedStudents = List.copyOf(builder.recognizedStudents);
        this.unrecognizedFaces = List.copyOf(builder.unrecognizedFaces);
        this.faceOutcomes = List.copyOf(builder.faceOutcomes);
        this.attendanceRecords = List.copyOf(builder.attendanceRecords);
        this.inserted = builder.inserted;
        this.upgraded = builder.upgraded;
        this.unchanged = builder.unchanged;
        this.message = builder.message;
        this.errorCode = builder.errorCode;
    }

    public boolean isSuccess() { return success; }
    public String getSubmissionId() { return submissionId; }
    public String getClassId() { return classId; }
    public LocalDate getDate() { return date; }
    public int getFacesDetected() { return facesDetected; }
    public int getFacesRecognized() { return recognizedStudents.size(); }
    public int getFacesUnrecognized() { return unrecognizedFaces.size(); }
    public List<RecognizedStudent> getRecognizedStudents() { return recognizedStudents; }
    public List<UnrecognizedFace> getUnrecognizedFaces() { return unrecognizedFaces; }
    public List<FaceOutcome> getFaceOutcomes() { return faceOutcomes; }
    public List<AttendanceRecord> getAttendanceRecords() { return attendanceRecords; }
    public int getInserted() { return inserted; }
    public int getUpgraded() { return upgraded; }
    public int getUnchanged() { return unchanged; }
    public String getMessage() { return message; }
    public ErrorCode getErrorCode() { return errorCode; }

    public boolean isRetryable() {
        return errorCode != null && errorCode.isRetryable();
    }

    static SubmissionResult failure(String submissionId, String classId, LocalDate date,
                                    ErrorCode errorCode, String message) {
        return builder()
                .success(false)
                .submissionId(submissionId)
                .classId(classId)
                .date(date)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean success;
        private String submissionId;
        private String classId;
        private LocalDate date;
        private int facesDetected;
        private List<RecognizedStudent> recognizedStudents = List.of();
        private List<UnrecognizedFace> unrecognizedFaces = List.of();
        private List<FaceOutcome> faceOutcomes = List.of();
        private List<AttendanceRecord> attendanceRecords = List.of();
        private int inserted;
        private int upgraded;
        private int unchanged;
        private String message;
        private ErrorCode errorCode;

        private Builder() {}

        public Builder success(boolean success) { this.success = success; return this; }
        public Builder submissionId(String submissionId) { this.submissionId = submissionId; return this; }
        public Builder classId(String classId) { this.classId = classId; return this; }
        public Builder date(LocalDate date) { this.date = date; return this; }
        public Builder facesDetected(int facesDetected) { this.facesDetected = facesDetected; return this; }
        public Builder recognizedStudents(List<RecognizedStudent> v) { this.recognizedStudents = v; return this; }
        public Builder unrecognizedFaces(List<UnrecognizedFace> v) { this.unrecognizedFaces = v; return this; }
        public Builder faceOutcomes(List<FaceOutcome> v) { this.faceOutcomes = v; return this; }
        public Builder attendanceRecords(List<AttendanceRecord> v) { this.attendanceRecords = v; return this; }
        public Builder inserted(int inserted) { this.inserted = inserted; return this; }
        public Builder upgraded(int upgraded) { this.upgraded = upgraded; return this; }
        public Builder unchanged(int unchanged) { this.unchanged = unchanged; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder errorCode(ErrorCode errorCode) { this.errorCode = errorCode; return this; }

        public SubmissionResult build() {
            return new SubmissionResult(this);
        }
    }

    @Override
    public String toString() {
        return "SubmissionResult{success=" + success + ", submissionId='" + submissionId
                + "', facesDetected=" + facesDetected + ", facesRecognized=" + getFacesRecognized()
                + ", errorCode=" + errorCode + ", message='" + message + "'}";
    }
}
