package com.strata.platform.config;

import com.strata.observability.HealthCheckRegistry;
import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.platform.infrastructure.health.StorageHealthCheck;
import com.strata.platform.infrastructure.health.TrainingServiceHealthCheck;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics, tracing and component health wiring.
 *
 * <p>Spans go through {@link GlobalOpenTelemetry}; without an installed SDK (or the Java agent)
 * they are no-ops.
 */
@Configuration
public class ObservabilityConfig {

    static final String INSTRUMENTATION_SCOPE = "com.strata.platform";

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, StrataProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            StorageHealthCheck storageHealthCheck, TrainingServiceHealthCheck trainingServiceHealthCheck) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(StorageHealthCheck.NAME, storageHealthCheck);
        registry.register(TrainingServiceHealthCheck.NAME, trainingServiceHealthCheck);
        return registry;
    }
}
