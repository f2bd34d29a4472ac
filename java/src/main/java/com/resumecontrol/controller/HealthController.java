package com.resumecontrol.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Liveness of the service and its database.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String VERSION = "1.0.0";
    static final Duration DATABASE_TIMEOUT = Duration.ofSeconds(5);

    private final DatabaseClient databaseClient;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "ResumeControl",
            "version", VERSION
        ));
    }

    /**
     * 200 when {@code SELECT 1} answers within the timeout, 503 otherwise.
     * HEAD is served by the same mapping.
     */
    @GetMapping("/v1/health")
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(DATABASE_TIMEOUT)
                .map(row -> ResponseEntity.ok(report("healthy", "connected")))
                .switchIfEmpty(Mono.fromSupplier(HealthController::unavailable))
                .onErrorResume(e -> {
                    log.warn("Database health check failed: {}", e.toString());
                    return Mono.just(unavailable());
                });
    }

    private static ResponseEntity<Map<String, String>> unavailable() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(report("unhealthy", "disconnected"));
    }

    private static Map<String, String> report(String status, String database) {
        return Map.of(
            "status", status,
            "database", database,
            "version", VERSION
        );
    }
}
