package com.reflow.ocr.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DocumentNotReadyException extends RuntimeException {
    private final UUID sessionId;

    public DocumentNotReadyException(UUID sessionId) {
        super("Document is not ready yet for session: " + sessionId);
        this.sessionId = sessionId;
    }
}
