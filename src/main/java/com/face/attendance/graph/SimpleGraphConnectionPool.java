package com.face.attendance.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Semaphore-bounded pool. JFalkorDB's {@code Graph} is not thread-safe, so every
 * pooled connection is its own {@link FalkorDBConnection}.
 */
public class SimpleGraphConnectionPool implements GraphConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleGraphConnectionPool.class);

    private final PoolConfig config;
    private final Supplier<GraphConnection> connectionFactory;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<GraphConnection> idleConnections = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalBorrowed = new AtomicLong();
    private final AtomicLong totalReleased = new AtomicLong();
    private final AtomicLong totalCreated = new AtomicLong();

    public SimpleGraphConnectionPool(PoolConfig config) {
        this(config, () -> new FalkorDBConnection(config.host(), config.port(), config.graphName()));
    }

    public SimpleGraphConnectionPool(PoolConfig config, Supplier<GraphConnection> connectionFactory) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory is required");
        this.permits = new Semaphore(config.maxTotal(), true);

        for (int i = 0; i < config.minIdle(); i++) {
            try {
                idleConnections.addLast(createConnection());
            } catch (RuntimeException e) {
                log.warn("pool.warmup.failed connection={}/{} error={}",
                        i + 1, config.minIdle(), e.getMessage());
            }
        }
        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public GraphConnection borrow() {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }
        try {
            if (!permits.tryAcquire(config.maxWait().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException(
                        "Timeout waiting for connection (maxWait=" + config.maxWait().toMillis() + "ms)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for connection", e);
        }

        GraphConnection conn;
        try {
            conn = idleConnections.pollFirst();
            if (conn != null && config.testOnBorrow() && !conn.isConnected()) {
                log.debug("Idle connection failed validation, replacing it");
                closeQuietly(conn);
                conn = null;
            }
            if (conn == null) {
                conn = createConnection();
            }
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }

        totalBorrowed.incrementAndGet();
        return conn;
    }

    @Override
    public void release(GraphConnection connection) {
        if (connection == null) {
            return;
        }
        totalReleased.incrementAndGet();
        if (closed.get() || idleConnections.size() >= config.maxIdle()) {
            closeQuietly(connection);
        } else {
            idleConnections.addLast(connection);
        }
        permits.release();
    }

    @Override
    public PoolStats getStats() {
        int idle = idleConnections.size();
        int active = config.maxTotal() - permits.availablePermits();
        return new PoolStats(active + idle, active, idle,
                totalBorrowed.get(), totalReleased.get(), totalCreated.get());
    }

    @Override
    public int getMaxTotal() {
        return config.maxTotal();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing connection pool...");
            GraphConnection conn;
            while ((conn = idleConnections.pollFirst()) != null) {
                closeQuietly(conn);
            }
            log.info("Connection pool closed");
        }
    }

    private GraphConnection createConnection() {
        GraphConnection conn = connectionFactory.get();
        totalCreated.incrementAndGet();
        return conn;
    }

    private void closeQuietly(GraphConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }
}
