package com.reflow.ocr.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionSummaryResponse(
    UUID id,
    String name,
    String description,
    @JsonProperty("created_at") OffsetDateTime createdAt,
    @JsonProperty("updated_at") OffsetDateTime updatedAt,
    @JsonProperty("page_count") int pageCount,
    SessionStatus status
) {
    public static SessionSummaryResponse from(Session session) {
        return new SessionSummaryResponse(
            session.id(),
            session.name(),
            session.description(),
            session.createdAt(),
            session.updatedAt(),
            session.pageCount(),
            session.status()
        );
    }
}
