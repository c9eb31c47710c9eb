package com.face.attendance.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable attendance row. The triple (classId, identityId, date) is unique in the store.
 *
 * <p>{@code confidenceScore} is only ever set for {@link AttendanceMethod#FACE_MATCH} records.</p>
 */
public final class AttendanceRecord {

    private final String classId;
    private final String identityId;
    private final LocalDate date;
    private final AttendanceStatus status;
    private final AttendanceMethod method;
    private final Double confidenceScore; // nullable
    private final String markedBy;
    private final Instant createdAt;

    private AttendanceRecord(Builder builder) {
        this.classId = Objects.requireNonNull(builder.classId, "classId is required");
        this.identityId = Objects.requireNonNull(builder.identityId, "identityId is required");
        this.date = Objects.requireNonNull(builder.date, "date is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.method = Objects.requireNonNull(builder.method, "method is required");
        if (builder.confidenceScore != null && builder.method != AttendanceMethod.FACE_MATCH) {
            throw new IllegalArgumentException("confidenceScore is only allowed for FACE_MATCH records");
        }
        this.confidenceScore = builder.confidenceScore;
        this.markedBy = builder.markedBy;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getClassId() { return classId; }
    public String getIdentityId() { return identityId; }
    public LocalDate getDate() { return date; }
    public AttendanceStatus getStatus() { return status; }
    public AttendanceMethod getMethod() { return method; }
    public Double getConfidenceScore() { return confidenceScore; }
    public String getMarkedBy() { return markedBy; }
    public Instant getCreatedAt() { return createdAt; }

    public Key key() {
        return new Key(classId, identityId, date);
    }

    public boolean isFaceMatch() {
        return method == AttendanceMethod.FACE_MATCH;
    }

    /**
     * Composite identity of an attendance row.
     */
    public record Key(String classId, String identityId, LocalDate date) {
        public Key {
            Objects.requireNonNull(classId, "classId is required");
            Objects.requireNonNull(identityId, "identityId is required");
            Objects.requireNonNull(date, "date is required");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttendanceRecord that = (AttendanceRecord) o;
        return classId.equals(that.classId)
                && identityId.equals(that.identityId)
                && date.equals(that.date)
                && status == that.status
                && method == that.method
                && Objects.equals(confidenceScore, that.confidenceScore)
                && Objects.equals(markedBy, that.markedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classId, identityId, date, status, method, confidenceScore, markedBy);
    }

    @Override
    public String toString() {
        return "AttendanceRecord{" +
                "classId='" + classId + '\'' +
                ", identityId='" + identityId + '\'' +
                ", date=" + date +
                ", status=" + status +
                ", method=" + method +
                ", confidenceScore=" + confidenceScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .classId(classId)
                .identityId(identityId)
                .date(date)
                .status(status)
                .method(method)
                .confidenceScore(confidenceScore)
                .markedBy(markedBy)
                .createdAt(createdAt);
    }

    public static final class Builder {
        private String classId;
        private String identityId;
        private LocalDate date;
        private AttendanceStatus status;
        private AttendanceMethod method;
        private Double confidenceScore;
        private String markedBy;
        private Instant createdAt;

        private Builder() {}

        public Builder classId(String classId) { this.classId = classId; return this; }
        public Builder identityId(String identityId) { this.identityId = identityId; return this; }
        public Builder date(LocalDate date) { this.date = date; return this; }
        public Builder status(AttendanceStatus status) { this.status = status; return this; }
        public Builder method(AttendanceMethod method) { this.method = method; return this; }
        public Builder confidenceScore(Double confidenceScore) { this.confidenceScore = confidenceScore; return this; }
        public Builder markedBy(String markedBy) { this.markedBy = markedBy; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public AttendanceRecord build() {
            return new AttendanceRecord(this);
        }
    }
}
