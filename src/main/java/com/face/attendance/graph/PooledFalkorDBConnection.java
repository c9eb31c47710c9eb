package com.face.attendance.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link GraphConnection} that borrows a pooled connection per call.
 * Registries and stores use it like any other connection.
 */
public class PooledFalkorDBConnection implements GraphConnection {

    private final GraphConnectionPool pool;
    private final String graphName;

    public PooledFalkorDBConnection(GraphConnectionPool pool, String graphName) {
        this.pool = Objects.requireNonNull(pool, "pool is required");
        this.graphName = graphName;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        GraphConnection conn = pool.borrow();
        try {
            conn.execute(query, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        GraphConnection conn = pool.borrow();
        try {
            return conn.query(query, params);
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public boolean isConnected() {
        GraphConnection conn;
        try {
            conn = pool.borrow();
        } catch (IllegalStateException e) {
            return false;
        }
        try {
            return conn.isConnected();
        } finally {
            pool.release(conn);
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        GraphConnection conn = pool.borrow();
        try {
            conn.createIndexes();
        } finally {
            pool.release(conn);
        }
    }

    public GraphConnectionPool getPool() {
        return pool;
    }

    /**
     * Closes the underlying pool.
     */
    @Override
    public void close() {
        pool.close();
    }
}
