package com.reflow.ocr.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Static metadata for uptime probes.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final String environment;
    private final String dataDir;

    public HealthController(
        @Value("${app.environment:development}") String environment,
        @Value("${app.storage.data-dir}") String dataDir
    ) {
        this.environment = environment;
        this.dataDir = dataDir;
    }

    @GetMapping
    public HealthResponse health() {
        return new HealthResponse("ok", OffsetDateTime.now(ZoneOffset.UTC), environment, dataDir);
    }
}
