package com.reflow.ocr.exception;

import java.util.UUID;

/**
 * The session exists but has no recognized document yet.
 */
public class DocumentNotFoundException extends EntityNotFoundException {

    public DocumentNotFoundException(UUID sessionId) {
        super("Document for session", sessionId);
    }
}
