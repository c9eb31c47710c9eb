package com.face.attendance.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered check and reports the worst status among them.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            results.put(check.getName(), run(check));
        }
        return HealthStatus.aggregate(results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={} error={}", check.getName(), e.getMessage());
            return HealthStatus.down("Check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
