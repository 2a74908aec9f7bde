package com.reflow.ocr.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.exception.TaskConflictException;
import com.reflow.ocr.infra.EventBroker;
import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.SessionEventType;
import com.reflow.ocr.model.TaskInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs background work per session and reports its lifecycle through the
 * {@link EventBroker}. Every outcome ends in exactly one terminal event; failures are
 * logged here and not rethrown, so pooled worker threads survive them.
 */
@Slf4j
@Service
public class TaskOrchestratorImpl implements TaskOrchestrator {

    private final EventBroker eventBroker;
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatTimeout;

    private final ConcurrentHashMap<UUID, RunningTask> tasks = new ConcurrentHashMap<>();
    private final Lock startLock = new ReentrantLock();

    public TaskOrchestratorImpl(
        EventBroker eventBroker,
        @Qualifier("recognitionTaskExecutor") Executor executor,
        ObjectMapper objectMapper,
        @Value("${app.events.heartbeat-timeout:15s}") Duration heartbeatTimeout
    ) {
        this.eventBroker = eventBroker;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.heartbeatTimeout = heartbeatTimeout;
    }

    @Override
    public UUID startTask(UUID sessionId, String kind, TaskWork work) {
        TaskInfo info = new TaskInfo(UUID.randomUUID(), sessionId, kind, OffsetDateTime.now(ZoneOffset.UTC));
        RunningTask task = new RunningTask(info);

        startLock.lock();
        try {
            Optional<TaskInfo> running = findActive(sessionId, kind);
            if (running.isPresent()) {
                log.warn("Session {}: rejecting '{}' task, {} is still running", sessionId, kind, running.get().id());
                throw new TaskConflictException(sessionId, kind, running.get().id());
            }
            tasks.put(info.id(), task);
        } finally {
            startLock.unlock();
        }

        publish(sessionId, taskEvent(SessionEventType.TASK_STARTED, info));
        log.info("Session {}: started '{}' task {}", sessionId, kind, info.id());

        try {
            executor.execute(() -> runTask(task, work));
        } catch (RejectedExecutionException e) {
            log.error("Session {}: executor rejected task {}", sessionId, info.id(), e);
            finish(task, taskEvent(SessionEventType.TASK_FAILED, info).with("error", describe(e)));
            throw e;
        }
        return info.id();
    }

    private void runTask(RunningTask task, TaskWork work) {
        if (!task.claim()) {
            return;
        }
        TaskInfo info = task.info();
        try {
            work.run();
            finish(task, taskEvent(SessionEventType.TASK_COMPLETED, info));
            log.info("Session {}: task {} completed", info.sessionId(), info.id());
        } catch (Exception e) {
            if (task.isCancelRequested() || e instanceof CancellationException || e instanceof InterruptedException) {
                finish(task, taskEvent(SessionEventType.TASK_CANCELLED, info));
                log.info("Session {}: task {} cancelled", info.sessionId(), info.id());
                return;
            }
            finish(task, taskEvent(SessionEventType.TASK_FAILED, info).with("error", describe(e)));
            log.error("Session {}: task {} failed", info.sessionId(), info.id(), e);
        } finally {
            task.release();
            tasks.remove(info.id(), task);
        }
    }

    private void finish(RunningTask task, SessionEvent terminalEvent) {
        tasks.remove(task.info().id(), task);
        publish(task.info().sessionId(), terminalEvent);
    }

    @Override
    public void cancelTask(UUID taskId) {
        RunningTask task = tasks.get(taskId);
        if (task == null) {
            log.debug("Cancel ignored, task {} is not running", taskId);
            return;
        }
        log.info("Session {}: cancelling task {}", task.info().sessionId(), taskId);
        if (task.cancel()) {
            finish(task, taskEvent(SessionEventType.TASK_CANCELLED, task.info()));
        }
    }

    @Override
    public List<TaskInfo> activeTasks(UUID sessionId) {
        return tasks.values().stream()
            .map(RunningTask::info)
            .filter(info -> info.sessionId().equals(sessionId))
            .sorted(Comparator.comparing(TaskInfo::createdAt))
            .toList();
    }

    @Override
    public boolean isCancellationRequested(UUID sessionId, String kind) {
        return tasks.values().stream()
            .filter(task -> task.info().sessionId().equals(sessionId) && task.info().kind().equals(kind))
            .anyMatch(RunningTask::isCancelRequested);
    }

    private Optional<TaskInfo> findActive(UUID sessionId, String kind) {
        return activeTasks(sessionId).stream()
            .filter(info -> info.kind().equals(kind))
            .findFirst();
    }

    @Override
    public void publish(UUID sessionId, SessionEvent event) {
        eventBroker.publish(sessionId, event);
    }

    @Override
    public SessionEventStream stream(UUID sessionId) {
        return new SessionEventStream(sessionId, eventBroker, objectMapper, heartbeatTimeout);
    }

    private static SessionEvent taskEvent(SessionEventType type, TaskInfo info) {
        return SessionEvent.of(type)
            .with("taskId", info.id())
            .with("kind", info.kind())
            .withTimestamp();
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * Start/cancel handshake. Whichever of {@link #claim()} and {@link #cancel()} runs
     * first decides who reports the outcome of a task that has not started yet.
     */
    private static final class RunningTask {
        private final TaskInfo info;
        private boolean started;
        private boolean cancelRequested;
        private Thread worker;

        RunningTask(TaskInfo info) {
            this.info = info;
        }

        TaskInfo info() {
            return info;
        }

        synchronized boolean claim() {
            if (started) {
                return false;
            }
            started = true;
            worker = Thread.currentThread();
            return true;
        }

        /**
         * @return {@code true} if the task never started and the caller must report it
         */
        synchronized boolean cancel() {
            cancelRequested = true;
            if (!started) {
                started = true;
                return true;
            }
            if (worker != null) {
                worker.interrupt();
            }
            return false;
        }

        synchronized boolean isCancelRequested() {
            return cancelRequested;
        }

        void release() {
            synchronized (this) {
                worker = null;
            }
            // pooled thread: drop an interrupt aimed at this task before the next one runs
            Thread.interrupted();
        }
    }
}
