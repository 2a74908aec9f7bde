package com.reflow.ocr.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.TestFixtures;
import com.reflow.ocr.exception.EmptySessionException;
import com.reflow.ocr.exception.TaskConflictException;
import com.reflow.ocr.infra.InMemoryEventBroker;
import com.reflow.ocr.model.PageSource;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionStatus;
import com.reflow.ocr.model.TaskInfo;
import com.reflow.ocr.pipeline.GrayscalePreprocessor;
import com.reflow.ocr.pipeline.PlaceholderTextRecognizer;
import com.reflow.ocr.pipeline.RecognitionPipeline;
import com.reflow.ocr.pipeline.TextRecognizer;
import com.reflow.ocr.pipeline.WholePageLayoutAnalyzer;
import com.reflow.ocr.repository.FileSystemSessionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RecognitionServiceImplTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = TestFixtures.objectMapper();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    private SessionServiceImpl sessionService;
    private InMemoryEventBroker broker;

    @BeforeEach
    void setUp() {
        sessionService = new SessionServiceImpl(new FileSystemSessionRepository(TestFixtures.storage(dataDir), objectMapper));
        broker = new InMemoryEventBroker();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Recognizing a one-page session streams the full progress sequence and ends ready")
    void shouldStreamProgressAndFinishReady() throws IOException {
        TaskOrchestratorImpl orchestrator = orchestrator(executor);
        RecognitionServiceImpl recognitionService = recognitionService(orchestrator);
        Session session = sessionService.create("S", null);
        sessionService.addPage(session.id(), TestFixtures.png(32, 24), "scan.png", PageSource.FILE, "image/png");

        List<JsonNode> events = new ArrayList<>();
        try (SessionEventStream stream = orchestrator.stream(session.id())) {
            recognitionService.startRecognition(session.id());
            while (stream.hasNext()) {
                JsonNode event = objectMapper.readTree(stream.next().substring("data: ".length()));
                if (!"heartbeat".equals(event.get("event").asText())) {
                    events.add(event);
                }
            }
        }

        assertThat(events).extracting(event -> event.get("event").asText()).containsExactly(
            "connected", "task-started", "recognition-start", "page-start", "page-complete",
            "recognition-finished", "task-completed");
        assertThat(events.get(2).get("totalPages").asInt()).isEqualTo(1);
        assertThat(events.get(3).get("pageIndex").asInt()).isZero();
        assertThat(events.get(4).get("pageIndex").asInt()).isZero();
        assertThat(events.get(5).get("pages").asInt()).isEqualTo(1);

        Session finished = sessionService.get(session.id());
        assertThat(finished.status()).isEqualTo(SessionStatus.READY);
        assertThat(finished.document()).isNotNull();
        assertThat(finished.document().pages()).hasSize(1);
    }

    @Test
    @DisplayName("A failing run records the error on the session and reports recognition-error")
    void shouldRecordFailure() throws IOException {
        TaskOrchestratorImpl orchestrator = orchestrator(executor);
        RecognitionServiceImpl recognitionService = recognitionService(orchestrator);
        Session session = sessionService.create("Corrupt", null);
        sessionService.addPage(session.id(), new byte[]{9, 9, 9}, "corrupt.png", PageSource.FILE, "image/png");

        List<JsonNode> events = new ArrayList<>();
        try (SessionEventStream stream = orchestrator.stream(session.id())) {
            recognitionService.startRecognition(session.id());
            while (stream.hasNext()) {
                events.add(objectMapper.readTree(stream.next().substring("data: ".length())));
            }
        }

        assertThat(events).extracting(event -> event.get("event").asText())
            .contains("recognition-error")
            .endsWith("task-failed");
        Session failed = sessionService.get(session.id());
        assertThat(failed.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(failed.lastError()).isNotBlank();
        assertThat(failed.document()).isNull();
    }

    @Test
    @DisplayName("Cancelling a run whose engine fails on interrupt reports task-cancelled, not an error")
    void shouldTreatInterruptedEngineFailureAsCancellation() throws Exception {
        CountDownLatch recognizing = new CountDownLatch(1);
        TextRecognizer blockingEngine = (image, block) -> {
            recognizing.countDown();
            try {
                Thread.sleep(TimeUnit.MINUTES.toMillis(1));
            } catch (InterruptedException e) {
                throw new IllegalStateException("OCR engine interrupted");
            }
            throw new IllegalStateException("OCR engine timed out");
        };
        TaskOrchestratorImpl orchestrator = orchestrator(executor);
        RecognitionServiceImpl recognitionService = recognitionService(orchestrator, blockingEngine);
        Session session = sessionService.create("Cancelled", null);
        sessionService.addPage(session.id(), TestFixtures.png(16, 16), "scan.png", PageSource.FILE, "image/png");

        List<String> events = new ArrayList<>();
        try (SessionEventStream stream = orchestrator.stream(session.id())) {
            UUID taskId = recognitionService.startRecognition(session.id());
            assertThat(recognizing.await(5, TimeUnit.SECONDS)).isTrue();
            orchestrator.cancelTask(taskId);
            while (stream.hasNext()) {
                events.add(objectMapper.readTree(stream.next().substring("data: ".length())).get("event").asText());
            }
        }

        assertThat(events).doesNotContain("recognition-error", "task-failed").endsWith("task-cancelled");
        Session cancelled = sessionService.get(session.id());
        assertThat(cancelled.status()).isEqualTo(SessionStatus.PROCESSING);
        assertThat(cancelled.lastError()).isNull();
        assertThat(orchestrator.activeTasks(session.id())).isEmpty();
    }

    @Test
    @DisplayName("Sessions without pages cannot be recognized")
    void shouldRejectEmptySession() {
        RecognitionServiceImpl recognitionService = recognitionService(orchestrator(executor));
        Session session = sessionService.create("Empty", null);

        assertThatThrownBy(() -> recognitionService.startRecognition(session.id()))
            .isInstanceOf(EmptySessionException.class);
        assertThat(sessionService.get(session.id()).status()).isEqualTo(SessionStatus.DRAFT);
    }

    @Test
    @DisplayName("A second recognition while one is pending is rejected")
    void shouldRejectConcurrentRecognition() {
        List<Runnable> queued = new ArrayList<>();
        TaskOrchestratorImpl orchestrator = orchestrator(queued::add);
        RecognitionServiceImpl recognitionService = recognitionService(orchestrator);
        Session session = sessionService.create("Busy", null);
        sessionService.addPage(session.id(), TestFixtures.png(8, 8), "a.png", PageSource.FILE, "image/png");

        UUID taskId = recognitionService.startRecognition(session.id());

        assertThat(sessionService.get(session.id()).status()).isEqualTo(SessionStatus.PROCESSING);
        assertThat(orchestrator.activeTasks(session.id()))
            .extracting(TaskInfo::id, TaskInfo::kind)
            .containsExactly(tuple(taskId, RecognitionService.TASK_KIND));
        assertThatThrownBy(() -> recognitionService.startRecognition(session.id()))
            .isInstanceOf(TaskConflictException.class);
    }

    private TaskOrchestratorImpl orchestrator(Executor taskExecutor) {
        return new TaskOrchestratorImpl(broker, taskExecutor, objectMapper, Duration.ofMillis(200));
    }

    private RecognitionServiceImpl recognitionService(TaskOrchestrator orchestrator) {
        return recognitionService(orchestrator, new PlaceholderTextRecognizer());
    }

    private RecognitionServiceImpl recognitionService(TaskOrchestrator orchestrator, TextRecognizer textRecognizer) {
        RecognitionPipeline pipeline = new RecognitionPipeline(sessionService, new GrayscalePreprocessor(),
            new WholePageLayoutAnalyzer(), textRecognizer);
        return new RecognitionServiceImpl(sessionService, orchestrator, pipeline);
    }
}
