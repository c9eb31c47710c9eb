package com.face.attendance.health;

import com.face.attendance.graph.GraphConnectionPool;
import com.face.attendance.graph.PoolStats;

/**
 * DEGRADED above 80% of pool capacity borrowed, DOWN when every connection is out.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final GraphConnectionPool pool;

    public ConnectionPoolHealthCheck(GraphConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        PoolStats stats = pool.getStats();
        double utilization = stats.utilization(pool.getMaxTotal());
        HealthStatus base;
        if (utilization >= 1.0) {
            base = HealthStatus.down("Connection pool exhausted");
        } else if (utilization >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded(String.format("Connection pool usage high: %.0f%%", utilization * 100));
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("maxTotal", pool.getMaxTotal())
                .withDetail("activeConnections", stats.activeConnections())
                .withDetail("idleConnections", stats.idleConnections())
                .withDetail("totalCreated", stats.totalCreated());
    }
}
