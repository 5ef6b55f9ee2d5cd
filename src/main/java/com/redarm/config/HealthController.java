package com.redarm.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ReadinessHealthIndicator readinessHealthIndicator;
    private final OcrSettings ocrSettings;

    public HealthController(ReadinessHealthIndicator readinessHealthIndicator, OcrSettings ocrSettings) {
        this.readinessHealthIndicator = readinessHealthIndicator;
        this.ocrSettings = ocrSettings;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Health dbHealth = readinessHealthIndicator.health();

        Map<String, Object> checks = new HashMap<>();
        checks.put("db", dbHealth.getDetails().getOrDefault("database", dbHealth.getStatus().getCode()));
        checks.put("ocr", ocrSettings.isConfigured() ? "CONFIGURED" : "NOT_CONFIGURED");

        Map<String, Object> response = new HashMap<>();
        response.put("status", dbHealth.getStatus().getCode());
        response.put("timestamp", Instant.now().toString());
        response.put("checks", checks);

        HttpStatus httpStatus = Status.UP.equals(dbHealth.getStatus())
                ? HttpStatus.OK
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(response);
    }
}
