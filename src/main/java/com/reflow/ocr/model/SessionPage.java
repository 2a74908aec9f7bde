package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionPage(
    UUID id,

    int index,

    String filename,

    @JsonProperty("original_name")
    String originalName,

    @JsonProperty("source_type")
    PageSource sourceType,

    PageMetadata metadata,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public SessionPage withIndex(int newIndex, OffsetDateTime now) {
        return new SessionPage(id, newIndex, filename, originalName, sourceType, metadata, createdAt, now);
    }
}
