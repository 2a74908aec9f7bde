package com.reflow.ocr.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class PageNotFoundException extends EntityNotFoundException {
    private final UUID sessionId;

    public PageNotFoundException(UUID sessionId, UUID pageId) {
        super("Page", pageId);
        this.sessionId = sessionId;
    }
}
