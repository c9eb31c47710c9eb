package com.face.attendance.health;

import com.face.attendance.graph.GraphConnection;

/**
 * Runs a trivial query against FalkorDB and reports its latency.
 */
public class FalkorDBHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public FalkorDBHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public HealthStatus check() {
        try {
            long start = System.nanoTime();
            connection.query("RETURN 1");
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            return HealthStatus.up()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", connection.getGraphName());
        } catch (RuntimeException e) {
            return HealthStatus.down("FalkorDB connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
