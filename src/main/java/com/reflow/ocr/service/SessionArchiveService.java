package com.reflow.ocr.service;

import com.reflow.ocr.model.Session;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Portable {@code .reflow-session} archives: a zip holding {@code session.json} and the
 * page images under {@code pages/}.
 */
public interface SessionArchiveService {

    String ARCHIVE_SUFFIX = ".reflow-session";

    /**
     * @return a temporary archive file; the caller deletes it once delivered
     */
    Path exportArchive(UUID sessionId);

    /**
     * Registers the archived session under a fresh id with fresh page ids.
     *
     * @throws com.reflow.ocr.exception.InvalidArchiveException if the payload is not a
     *         session archive
     */
    Session importArchive(byte[] archive);
}
