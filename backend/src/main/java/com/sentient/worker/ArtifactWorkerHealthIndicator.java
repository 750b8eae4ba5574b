package com.sentient.worker;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator HealthIndicator for the artifact worker loop.
 * Included in GET /actuator/health as {@code artifactWorker}.
 */
@Component
@RequiredArgsConstructor
public class ArtifactWorkerHealthIndicator implements HealthIndicator {

    private final ArtifactWorker artifactWorker;
    private final WorkerStats stats;

    @Override
    public Health health() {
        if (!artifactWorker.isEnabled()) {
            return Health.up()
                    .withDetail("enabled", false)
                    .build();
        }

        Health.Builder builder = artifactWorker.isRunning() ? Health.up() : Health.down();
        builder.withDetail("enabled", true)
                .withDetail("processed", stats.getProcessed())
                .withDetail("errors", stats.getErrors())
                .withDetail("pollErrors", stats.getPollErrors());
        if (stats.getLastPollAt() != null) {
            builder.withDetail("lastPollAt", stats.getLastPollAt().toString());
        }
        return builder.build();
    }
}
