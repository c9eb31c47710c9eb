package com.face.attendance.health;

/**
 * Checks one dependency of the engine.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
