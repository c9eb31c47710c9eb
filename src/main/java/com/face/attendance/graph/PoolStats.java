package com.face.attendance.graph;

/**
 * Snapshot of a {@link GraphConnectionPool}.
 *
 * @param totalConnections  active + idle
 * @param activeConnections currently borrowed
 * @param idleConnections   available for borrowing
 * @param totalBorrowed     cumulative borrows
 * @param totalReleased     cumulative releases
 * @param totalCreated      cumulative connections opened
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        long totalBorrowed,
        long totalReleased,
        long totalCreated
) {

    /**
     * Fraction of the pool's capacity that is currently borrowed.
     */
    public double utilization(int maxTotal) {
        return maxTotal <= 0 ? 0.0 : (double) activeConnections / maxTotal;
    }
}
