package com.warden.controlplane.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the control plane, bound from {@code warden.service.*}.
 *
 * <pre>
 * warden:
 *   service:
 *     name: warden-control-plane
 *     environment: production
 *     grpc-port: 8090
 *     auth:
 *       issuer: https://identity.example.com/realms/warden
 *       audience: warden-server
 *       signing-key: ${WARDEN_SIGNING_KEY}
 *     events:
 *       capacity: 1024
 *       offer-timeout: 100ms
 *     invitations:
 *       expiry: 7d
 * </pre>
 *
 * @param name service name used for logging and metrics
 * @param environment deployment environment
 * @param description human-readable description
 * @param grpcPort port of the gRPC server (default 8090)
 * @param grpcEnabled whether the gRPC server starts with the application context
 */
@ConfigurationProperties(prefix = "warden.service")
@Validated
public record ControlPlaneProperties(
        @NotBlank String name,
        String environment,
        String description,
        int grpcPort,
        Boolean grpcEnabled,
        @Valid Auth auth,
        @Valid Events events,
        @Valid Invitations invitations) {

    public ControlPlaneProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (grpcPort <= 0) {
            grpcPort = 8090;
        }
        if (grpcEnabled == null) {
            grpcEnabled = Boolean.TRUE;
        }
        if (events == null) {
            events = new Events(0, null);
        }
        if (invitations == null) {
            invitations = new Invitations(null);
        }
    }

    /**
     * Access token verification.
     *
     * @param issuer expected {@code iss} claim
     * @param audience expected {@code aud} claim; blank to skip the check
     * @param signingKey HMAC key shared with the identity provider
     */
    public record Auth(@NotBlank String issuer, String audience, @NotBlank String signingKey) {

        public Auth {
            if (audience != null && audience.isBlank()) {
                audience = null;
            }
        }
    }

    /**
     * In-process event queue.
     *
     * @param capacity maximum number of undelivered events
     * @param offerTimeout how long a publisher waits for space
     */
    public record Events(@Positive int capacity, Duration offerTimeout) {

        public Events {
            if (capacity <= 0) {
                capacity = 1024;
            }
            if (offerTimeout == null) {
                offerTimeout = Duration.ofMillis(100);
            }
        }
    }

    /** @param expiry age after which an invitation can no longer be resolved */
    public record Invitations(Duration expiry) {

        public Invitations {
            if (expiry == null) {
                expiry = Duration.ofDays(7);
            }
        }
    }
}
