package com.face.attendance.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Submission context sets its keys and removes them on close")
    void submission() {
        try (LogContext ctx = LogContext.forSubmission("sub-1", "bio-101", LocalDate.of(2024, 3, 4))) {
            assertEquals("sub-1", MDC.get("submissionId"));
            assertEquals("bio-101", MDC.get("classId"));
            assertEquals("2024-03-04", MDC.get("date"));
            assertEquals("submit", MDC.get("operation"));
        }
        assertNull(MDC.get("submissionId"));
        assertNull(MDC.get("classId"));
    }

    @Test
    @DisplayName("Closing leaves unrelated MDC entries alone")
    void leavesOthers() {
        MDC.put("requestId", "r-9");
        try (LogContext ctx = LogContext.forEnrollment("alice").with("actor", "admin")) {
            assertEquals("admin", MDC.get("actor"));
        }
        assertNull(MDC.get("identityId"));
        assertNull(MDC.get("actor"));
        assertEquals("r-9", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Propagated tasks carry the caller's MDC and restore the worker's afterwards")
    void propagate() throws Exception {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            worker.submit(() -> MDC.put("stale", "x")).get();
            MDC.put("classId", "chem-2");

            String seen = worker.submit(LogContext.propagate(() -> MDC.get("classId") + "/" + MDC.get("stale"))).get();
            String after = worker.submit(() -> MDC.get("stale")).get();

            assertEquals("chem-2/null", seen);
            assertEquals("x", after);
        } finally {
            worker.shutdownNow();
        }
    }

    @Test
    @DisplayName("Submission ids are unique")
    void ids() {
        assertNotEquals(LogContext.generateSubmissionId(), LogContext.generateSubmissionId());
    }
}
