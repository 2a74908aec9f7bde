package com.reflow.ocr.repository;

import com.reflow.ocr.model.Session;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Durable storage for session manifests and page bytes. Holds no state of its own.
 */
public interface SessionRepository {

    /**
     * Lazily reads every session directory with a readable manifest. Directories with a
     * missing or corrupt manifest are skipped. The stream holds a directory handle and
     * must be closed.
     */
    Stream<Session> loadAll();

    void save(Session session);

    void delete(UUID sessionId);

    Path pagePath(UUID sessionId, String filename);

    void writePage(UUID sessionId, String filename, byte[] data);

    Optional<byte[]> readPage(UUID sessionId, String filename);

    void deletePage(UUID sessionId, String filename);
}
