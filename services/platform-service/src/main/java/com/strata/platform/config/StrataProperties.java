package com.strata.platform.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code strata.*}, validated at startup.
 *
 * <pre>
 * strata:
 *   service-name: platform-service
 *   session:
 *     secret: ${STRATA_SESSION_SECRET}
 *     issuer: strata
 *     ttl: 24h
 *   training:
 *     base-url: http://training-service:8000
 *     connect-timeout: 5s
 *     read-timeout: 5m
 *   bootstrap:
 *     root-email: root@strata.local
 *     root-password: ${STRATA_ROOT_PASSWORD}
 *   cors:
 *     allowed-origins: http://localhost:5173
 * </pre>
 *
 * @param serviceName name used as the {@code service} tag on metrics
 * @param session     session token signing
 * @param training    downstream training service
 * @param bootstrap   Root account created on first start
 * @param cors        browser origins allowed to call {@code /api/**}
 */
@Validated
@ConfigurationProperties(prefix = "strata")
public record StrataProperties(
        String serviceName,
        @NotNull @Valid Session session,
        @NotNull @Valid Training training,
        @NotNull @Valid Bootstrap bootstrap,
        Cors cors) {

    public StrataProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "platform-service";
        }
        if (cors == null) {
            cors = new Cors(null);
        }
    }

    /**
     * @param secret HMAC secret, at least 32 bytes
     * @param issuer value of the {@code iss} claim
     * @param ttl    token lifetime, 24 hours unless set
     */
    public record Session(@NotBlank String secret, String issuer, Duration ttl) {

        public Session {
            if (issuer == null || issuer.isBlank()) {
                issuer = "strata";
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                ttl = Duration.ofHours(24);
            }
        }
    }

    public record Training(@NotBlank String baseUrl, Duration connectTimeout, Duration readTimeout) {

        public Training {
            if (baseUrl != null && baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofMinutes(5);
            }
        }
    }

    /**
     * @param enabled      create the Root account when it is missing
     * @param rootEmail    login of the Root account
     * @param rootPassword initial Root password
     */
    public record Bootstrap(Boolean enabled, @NotBlank String rootEmail, @NotBlank String rootPassword) {

        public Bootstrap {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
        }
    }

    public record Cors(List<String> allowedOrigins) {

        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
            }
            allowedOrigins = List.copyOf(allowedOrigins);
        }
    }
}
