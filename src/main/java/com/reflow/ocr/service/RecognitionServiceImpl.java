package com.reflow.ocr.service;

import com.reflow.ocr.exception.EmptySessionException;
import com.reflow.ocr.exception.SessionNotFoundException;
import com.reflow.ocr.exception.TaskConflictException;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.SessionEventType;
import com.reflow.ocr.model.TaskInfo;
import com.reflow.ocr.pipeline.RecognitionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecognitionServiceImpl implements RecognitionService {

    private final SessionService sessionService;
    private final TaskOrchestrator taskOrchestrator;
    private final RecognitionPipeline pipeline;

    @Override
    public UUID startRecognition(UUID sessionId) {
        Session session = sessionService.get(sessionId);
        if (session.pages().isEmpty()) {
            throw new EmptySessionException(sessionId);
        }
        Optional<TaskInfo> running = taskOrchestrator.activeTasks(sessionId).stream()
            .filter(task -> TASK_KIND.equals(task.kind()))
            .findFirst();
        if (running.isPresent()) {
            throw new TaskConflictException(sessionId, TASK_KIND, running.get().id());
        }

        sessionService.markProcessing(sessionId);
        try {
            return taskOrchestrator.startTask(sessionId, TASK_KIND, () -> recognize(sessionId));
        } catch (TaskConflictException e) {
            // lost the race to a concurrent request; that request owns the processing status
            throw e;
        } catch (RuntimeException e) {
            log.error("Session {}: unable to start recognition", sessionId, e);
            sessionService.markError(sessionId, "Unable to start recognition: " + TaskOrchestratorImpl.describe(e));
            throw e;
        }
    }

    private void recognize(UUID sessionId) {
        try {
            pipeline.run(sessionId, event -> taskOrchestrator.publish(sessionId, event));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted() || taskOrchestrator.isCancellationRequested(sessionId, TASK_KIND)) {
                // collaborators may turn the interrupt into their own exception type
                CancellationException cancellation = new CancellationException("Recognition cancelled for session " + sessionId);
                cancellation.initCause(e);
                throw cancellation;
            }
            String message = TaskOrchestratorImpl.describe(e);
            log.warn("Session {}: recognition failed: {}", sessionId, message);
            recordFailure(sessionId, message);
            taskOrchestrator.publish(sessionId, SessionEvent.of(SessionEventType.RECOGNITION_ERROR)
                .with("message", message));
            throw e;
        }
    }

    private void recordFailure(UUID sessionId, String message) {
        try {
            sessionService.markError(sessionId, message);
        } catch (SessionNotFoundException e) {
            log.debug("Session {} was deleted while recognizing", sessionId);
        }
    }
}
