package com.face.attendance.graph;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of {@link SimpleGraphConnectionPool}: where FalkorDB lives and how many
 * connections may be open, kept idle and pre-opened.
 *
 * @param host         FalkorDB host
 * @param port         FalkorDB port
 * @param graphName    graph holding signatures, attendance and audit nodes
 * @param maxTotal     upper bound of borrowed plus idle connections
 * @param maxIdle      idle connections kept on release
 * @param minIdle      connections opened when the pool starts
 * @param maxWait      how long {@code borrow} blocks when the pool is exhausted
 * @param testOnBorrow whether idle connections are pinged before being handed out
 */
public record PoolConfig(String host, int port, String graphName,
                         int maxTotal, int maxIdle, int minIdle,
                         Duration maxWait, boolean testOnBorrow) {

    public PoolConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("graphName must not be blank");
        }
        if (maxTotal <= 0) {
            throw new IllegalArgumentException("maxTotal must be > 0");
        }
        if (minIdle < 0 || minIdle > maxIdle || maxIdle > maxTotal) {
            throw new IllegalArgumentException("Expected 0 <= minIdle <= maxIdle <= maxTotal, got "
                    + minIdle + "/" + maxIdle + "/" + maxTotal);
        }
        Objects.requireNonNull(maxWait, "maxWait is required");
        if (maxWait.isNegative() || maxWait.isZero()) {
            throw new IllegalArgumentException("maxWait must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 6379;
        private String graphName = "face-attendance";
        private int maxTotal = 16;
        private int maxIdle = 8;
        private int minIdle = 1;
        private Duration maxWait = Duration.ofSeconds(3);
        private boolean testOnBorrow = true;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder graphName(String graphName) {
            this.graphName = graphName;
            return this;
        }

        public Builder maxTotal(int maxTotal) {
            this.maxTotal = maxTotal;
            return this;
        }

        public Builder maxIdle(int maxIdle) {
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder minIdle(int minIdle) {
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxWaitMillis(long maxWaitMillis) {
            this.maxWait = Duration.ofMillis(maxWaitMillis);
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(host, port, graphName, maxTotal, maxIdle, minIdle, maxWait, testOnBorrow);
        }
    }
}
