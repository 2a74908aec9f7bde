package com.reflow.ocr.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TaskConflictException extends RuntimeException {
    private final UUID sessionId;
    private final UUID runningTaskId;

    public TaskConflictException(UUID sessionId, String kind, UUID runningTaskId) {
        super("Task '" + kind + "' is already running for session " + sessionId + ": " + runningTaskId);
        this.sessionId = sessionId;
        this.runningTaskId = runningTaskId;
    }
}
