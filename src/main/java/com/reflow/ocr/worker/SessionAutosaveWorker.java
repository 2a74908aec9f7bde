package com.reflow.ocr.worker;

import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.repository.StorageProperties;
import com.reflow.ocr.service.SessionService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically writes dirty sessions to disk, and once more on shutdown.
 */
@Slf4j
@Component
public class SessionAutosaveWorker {

    private final SessionService sessionService;
    private final TaskScheduler scheduler;
    private final Duration interval;

    private ScheduledFuture<?> schedule;

    public SessionAutosaveWorker(
        SessionService sessionService,
        @Qualifier("autosaveScheduler") TaskScheduler scheduler,
        StorageProperties storageProperties
    ) {
        this.sessionService = sessionService;
        this.scheduler = scheduler;
        this.interval = storageProperties.effectiveAutosaveInterval();
    }

    @PostConstruct
    public synchronized void start() {
        if (schedule != null) {
            return;
        }
        schedule = scheduler.scheduleWithFixedDelay(this::autosave, interval);
        log.info("Session autosave every {}", interval);
    }

    void autosave() {
        try {
            sessionService.flush();
        } catch (StorageException e) {
            // failed sessions stay dirty and are retried on the next run
            log.error("Autosave failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
        int written = sessionService.flush();
        log.info("Final autosave wrote {} sessions", written);
    }
}
