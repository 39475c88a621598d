package com.cellarmate.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Liveness only: the process answers.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Readiness: aggregated actuator health.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            return new HealthResponse(healthComponent.getStatus().getCode(), Instant.now(clock).toString());
        } catch (RuntimeException e) {
            log.warn("Readiness check failed", e);
            return new HealthResponse("DOWN", Instant.now(clock).toString());
        }
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601
    ) {}
}
