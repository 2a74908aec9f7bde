package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Recognition output attached to a session once a run succeeds.
 */
public record Document(
    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("language_hint")
    String languageHint,

    List<DocumentPage> pages
) {

    public static final String DEFAULT_LANGUAGE_HINT = "rus+eng";

    public Document {
        languageHint = languageHint == null ? DEFAULT_LANGUAGE_HINT : languageHint;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
