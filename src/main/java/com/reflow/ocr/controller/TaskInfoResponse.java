package com.reflow.ocr.controller;

import com.reflow.ocr.model.TaskInfo;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TaskInfoResponse(
    UUID taskId,
    UUID sessionId,
    String kind,
    OffsetDateTime createdAt
) {
    public static TaskInfoResponse from(TaskInfo info) {
        return new TaskInfoResponse(info.id(), info.sessionId(), info.kind(), info.createdAt());
    }
}
