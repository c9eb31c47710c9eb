package com.face.attendance.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("Backoff doubles and is capped")
    void exponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, 100, 2.0, 300);

        assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(200), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(300), policy.backoffAfter(3));
        assertEquals(Duration.ofMillis(300), policy.backoffAfter(4));
    }

    @Test
    @DisplayName("none() makes a single attempt")
    void none() {
        assertEquals(1, RetryPolicy.none().maxAttempts());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 100, 2.0, 200));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1, 2.0, 200));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 100, 0.5, 200));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 300, 2.0, 200));
    }
}
