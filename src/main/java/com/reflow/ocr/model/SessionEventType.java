package com.reflow.ocr.model;

public enum SessionEventType {
    CONNECTED("connected"),
    TASK_STARTED("task-started"),
    RECOGNITION_START("recognition-start"),
    PAGE_START("page-start"),
    PAGE_COMPLETE("page-complete"),
    RECOGNITION_FINISHED("recognition-finished"),
    RECOGNITION_ERROR("recognition-error"),
    TASK_COMPLETED("task-completed"),
    TASK_FAILED("task-failed"),
    TASK_CANCELLED("task-cancelled"),
    HEARTBEAT("heartbeat");

    private final String wireName;

    SessionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Terminal events end a live event stream.
     */
    public boolean isTerminal() {
        return this == TASK_COMPLETED || this == TASK_FAILED || this == TASK_CANCELLED;
    }
}
