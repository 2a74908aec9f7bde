package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of a scanning session. The registry replaces snapshots
 * wholesale, so a reader never observes a half-applied mutation.
 */
public record Session(
    UUID id,

    String name,

    String description,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt,

    @JsonProperty("page_count")
    int pageCount,

    SessionStatus status,

    @JsonProperty("autosave_enabled")
    boolean autosaveEnabled,

    List<SessionPage> pages,

    Document document,

    @JsonProperty("last_error")
    String lastError,

    @JsonProperty("last_recognized_at")
    OffsetDateTime lastRecognizedAt
) {

    public Session {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Manifest fields a stored or imported snapshot cannot do without, in manifest naming.
     * Empty for every snapshot the registry creates.
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>(4);
        if (id == null) {
            missing.add("id");
        }
        if (name == null) {
            missing.add("name");
        }
        if (createdAt == null) {
            missing.add("created_at");
        }
        if (status == null) {
            missing.add("status");
        }
        return missing;
    }

    /**
     * Replaces the page sequence; {@code page_count} follows the new list. A recognized
     * document no longer matches the pages, so a ready session drops back to draft.
     */
    public Session withPages(List<SessionPage> newPages, OffsetDateTime now) {
        SessionStatus newStatus = status == SessionStatus.READY ? SessionStatus.DRAFT : status;
        return new Session(id, name, description, createdAt, now, newPages.size(), newStatus,
            autosaveEnabled, newPages, null, lastError, lastRecognizedAt);
    }

    public Session withDetails(String newName, String newDescription, OffsetDateTime now) {
        return new Session(id, newName, newDescription, createdAt, now, pageCount, status,
            autosaveEnabled, pages, document, lastError, lastRecognizedAt);
    }

    public Session withStatus(SessionStatus newStatus, String error, OffsetDateTime now) {
        Document kept = newStatus == SessionStatus.READY ? document : null;
        return new Session(id, name, description, createdAt, now, pageCount, newStatus,
            autosaveEnabled, pages, kept, error, lastRecognizedAt);
    }

    public Session withDocument(Document newDocument, OffsetDateTime now) {
        return new Session(id, name, description, createdAt, now, pageCount, SessionStatus.READY,
            autosaveEnabled, pages, newDocument, null, now);
    }
}
