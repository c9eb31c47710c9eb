package com.face.attendance.health;

import com.face.attendance.model.HttpFaceModelClient;

/**
 * Checks that the remote face model server answers.
 */
public class ModelServerHealthCheck implements HealthCheck {

    private final HttpFaceModelClient client;

    public ModelServerHealthCheck(HttpFaceModelClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "modelServer";
    }

    @Override
    public HealthStatus check() {
        HealthStatus status = client.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.down("Model server not reachable");
        return status.withDetail("baseUrl", client.getBaseUrl());
    }
}
