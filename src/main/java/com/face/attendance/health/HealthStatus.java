package com.face.attendance.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component, or of the whole engine.
 *
 * <p>DEGRADED still serves submissions (for example an empty signature registry
 * or high heap usage); only DOWN makes the health endpoint answer 503.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status {
        UP, DEGRADED, DOWN;

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    /**
     * Combines named component results. The worst status wins and its message is
     * prefixed with the component name; each component appears under its name in
     * the details.
     */
    public static HealthStatus aggregate(Map<String, HealthStatus> components) {
        if (components.isEmpty()) {
            return up("No health checks registered");
        }
        Status overall = Status.UP;
        String message = "OK";
        Map<String, Object> details = new LinkedHashMap<>();
        for (Map.Entry<String, HealthStatus> component : components.entrySet()) {
            HealthStatus result = component.getValue();
            details.put(component.getKey(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (overall.worse(result.status()) != overall) {
                overall = result.status();
                message = component.getKey() + ": " + result.message();
            }
        }
        return new HealthStatus(overall, message, details);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(details);
        extended.put(key, value);
        return new HealthStatus(status, message, extended);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
