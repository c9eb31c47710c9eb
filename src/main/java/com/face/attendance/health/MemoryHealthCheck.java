package com.face.attendance.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Heap usage check. Photos are held in memory during a submission, so a nearly
 * full heap is reported before it turns into failed uploads.
 */
public class MemoryHealthCheck implements HealthCheck {

    private final double degradedThreshold;
    private final double downThreshold;

    public MemoryHealthCheck() {
        this(0.80, 0.95);
    }

    public MemoryHealthCheck(double degradedThreshold, double downThreshold) {
        if (degradedThreshold <= 0.0 || downThreshold > 1.0 || degradedThreshold >= downThreshold) {
            throw new IllegalArgumentException("Require 0 < degradedThreshold < downThreshold <= 1");
        }
        this.degradedThreshold = degradedThreshold;
        this.downThreshold = downThreshold;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMB = heap.getUsed() / (1024 * 1024);
        long maxMB = heap.getMax() / (1024 * 1024);
        double usage = maxMB > 0 ? (double) usedMB / maxMB : 0.0;

        HealthStatus base;
        if (usage >= downThreshold) {
            base = HealthStatus.down(String.format("Heap usage critical: %.1f%%", usage * 100));
        } else if (usage >= degradedThreshold) {
            base = HealthStatus.degraded(String.format("Heap usage high: %.1f%%", usage * 100));
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("heapUsedMB", usedMB)
                .withDetail("heapMaxMB", maxMB);
    }
}
