package com.face.attendance.health;

import com.face.attendance.registry.SignatureRegistry;

/**
 * Reports whether the signature registry answers and how many identities are enrolled.
 */
public class SignatureRegistryHealthCheck implements HealthCheck {

    private final SignatureRegistry registry;

    public SignatureRegistryHealthCheck(SignatureRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "signatureRegistry";
    }

    @Override
    public HealthStatus check() {
        if (!registry.isAvailable()) {
            return HealthStatus.down("Signature registry unavailable")
                    .withDetail("type", registry.getClass().getSimpleName());
        }
        HealthStatus status = registry.size() == 0
                ? HealthStatus.degraded("No identities enrolled")
                : HealthStatus.up();
        return status
                .withDetail("type", registry.getClass().getSimpleName())
                .withDetail("enrolled", registry.size())
                .withDetail("dimension", registry.dimension())
                .withDetail("metric", registry.metric().name());
    }
}
