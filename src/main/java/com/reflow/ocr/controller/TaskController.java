package com.reflow.ocr.controller;

import com.reflow.ocr.service.SessionEventStream;
import com.reflow.ocr.service.SessionService;
import com.reflow.ocr.service.TaskOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Background task control and the live progress stream of a session.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class TaskController {

    private final SessionService sessionService;
    private final TaskOrchestrator taskOrchestrator;

    @GetMapping("/{id}/tasks")
    public List<TaskInfoResponse> activeTasks(@PathVariable UUID id) {
        sessionService.get(id);
        return taskOrchestrator.activeTasks(id).stream()
            .map(TaskInfoResponse::from)
            .toList();
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<Void> cancelTask(@PathVariable UUID taskId) {
        taskOrchestrator.cancelTask(taskId);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<StreamingResponseBody> events(@PathVariable UUID id) {
        sessionService.get(id);
        StreamingResponseBody body = out -> {
            try (SessionEventStream stream = taskOrchestrator.stream(id)) {
                while (stream.hasNext()) {
                    out.write(stream.next().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            }
            log.debug("Session {}: event stream delivered", id);
        };
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .header("Cache-Control", "no-cache")
            .body(body);
    }
}
