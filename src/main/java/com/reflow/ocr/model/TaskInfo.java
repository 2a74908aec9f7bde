package com.reflow.ocr.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TaskInfo(
    UUID id,
    UUID sessionId,
    String kind,
    OffsetDateTime createdAt
) {}
