package com.reflow.ocr.service;

import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.PageSource;
import com.reflow.ocr.model.Session;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Authoritative in-memory registry of sessions, persisted lazily by {@link #flush()}.
 * Every mutating call returns the new immutable snapshot.
 */
public interface SessionService {
    List<Session> list();
    Session get(UUID sessionId);
    Session create(String name, String description);
    Session update(UUID sessionId, String name, String description);
    void delete(UUID sessionId);

    Session addPage(UUID sessionId, byte[] data, String originalName, PageSource source, String mimetype);
    Session removePage(UUID sessionId, UUID pageId);
    Session reorderPages(UUID sessionId, List<UUID> order);
    Path pagePath(UUID sessionId, UUID pageId);
    byte[] readPage(UUID sessionId, UUID pageId);

    Session markProcessing(UUID sessionId);
    Session markError(UUID sessionId, String message);
    Session saveDocument(UUID sessionId, Document document);

    Session register(Session session);
    int flush();
}
