package com.reflow.ocr.controller;

import java.time.OffsetDateTime;

public record HealthResponse(
    String status,
    OffsetDateTime timestamp,
    String environment,
    String dataDir
) {
}
