package com.reflow.ocr.service;

import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.TaskInfo;

import java.util.List;
import java.util.UUID;

public interface TaskOrchestrator {

    /**
     * Publishes {@code task-started} and runs {@code work} in the background.
     *
     * @return id of the new task, available before the work finishes
     * @throws com.reflow.ocr.exception.TaskConflictException if the session already
     *         runs a task of the same kind
     */
    UUID startTask(UUID sessionId, String kind, TaskWork work);

    void cancelTask(UUID taskId);

    List<TaskInfo> activeTasks(UUID sessionId);

    /**
     * @return {@code true} while a live task of {@code kind} for the session has been asked to stop
     */
    boolean isCancellationRequested(UUID sessionId, String kind);

    void publish(UUID sessionId, SessionEvent event);

    SessionEventStream stream(UUID sessionId);
}
