package com.strata.platform.infrastructure.health;

import com.strata.observability.ComponentHealth;
import com.strata.observability.HealthCheck;
import com.strata.platform.application.training.TrainingServiceClient;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * The training service is optional for most endpoints, so being unreachable only degrades
 * overall health.
 */
@Component
public class TrainingServiceHealthCheck implements HealthCheck {

    public static final String NAME = "training-service";

    private final TrainingServiceClient client;

    public TrainingServiceHealthCheck(TrainingServiceClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            return client.isAvailable()
                    ? ComponentHealth.healthy(NAME, StorageHealthCheck.elapsedMs(start))
                    : ComponentHealth.degraded(NAME, "Training service unreachable", StorageHealthCheck.elapsedMs(start));
        });
    }
}
