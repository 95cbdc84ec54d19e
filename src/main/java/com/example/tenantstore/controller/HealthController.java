package com.example.tenantstore.controller;

import com.example.tenantstore.registry.ContainerRegistry;
import com.example.tenantstore.registry.HealthReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class HealthController {

    private final ContainerRegistry registry;

    public HealthController(ContainerRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        // the registry pings each container with blocking calls
        return Mono.fromCallable(registry::healthCheck)
                .subscribeOn(Schedulers.boundedElastic())
                .map(HealthController::toResponse);
    }

    @GetMapping("/actuator/health")
    public Mono<ResponseEntity<Map<String, Object>>> actuatorHealth() {
        return health();
    }

    static ResponseEntity<Map<String, Object>> toResponse(HealthReport report) {
        Map<String, Object> body = report.toMap();
        body.put("service", "tenant-datastore");
        HttpStatus status = report.isUp() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }
}
