package com.reflow.ocr.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EmptySessionException extends RuntimeException {
    private final UUID sessionId;

    public EmptySessionException(UUID sessionId) {
        super("Session has no pages to process: " + sessionId);
        this.sessionId = sessionId;
    }
}
