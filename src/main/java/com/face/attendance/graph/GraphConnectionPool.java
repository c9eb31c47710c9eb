package com.face.attendance.graph;

/**
 * Pool of {@link GraphConnection}s with borrow/release semantics.
 */
public interface GraphConnectionPool extends AutoCloseable {

    /**
     * Blocks until a connection is available or the configured wait expires.
     *
     * @throws IllegalStateException if the pool is closed or the wait expires
     */
    GraphConnection borrow();

    void release(GraphConnection connection);

    PoolStats getStats();

    /**
     * Maximum number of connections this pool will open.
     */
    int getMaxTotal();

    @Override
    void close();
}
