package com.face.attendance.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Read-only context of one attendance submission: which class, which day,
 * and the similarity threshold in force.
 */
public record SessionContext(String classId, LocalDate date, double threshold) {

    public SessionContext {
        if (classId == null || classId.isBlank()) {
            throw new IllegalArgumentException("classId is required");
        }
        Objects.requireNonNull(date, "date is required");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
    }
}
