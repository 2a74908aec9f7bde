package com.reflow.ocr.pipeline;

import com.reflow.ocr.TestFixtures;
import com.reflow.ocr.exception.EmptySessionException;
import com.reflow.ocr.exception.RecognitionException;
import com.reflow.ocr.model.BlockType;
import com.reflow.ocr.model.BoundingBox;
import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.DocumentPage;
import com.reflow.ocr.model.PageSource;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.SessionEventType;
import com.reflow.ocr.model.SessionStatus;
import com.reflow.ocr.repository.FileSystemSessionRepository;
import com.reflow.ocr.service.SessionServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionPipelineTest {

    @TempDir
    Path dataDir;

    private SessionServiceImpl sessionService;
    private RecognitionPipeline pipeline;
    private final List<SessionEvent> emitted = new ArrayList<>();

    @BeforeEach
    void setUp() {
        sessionService = new SessionServiceImpl(
            new FileSystemSessionRepository(TestFixtures.storage(dataDir), TestFixtures.objectMapper()));
        pipeline = new RecognitionPipeline(sessionService, new GrayscalePreprocessor(),
            new WholePageLayoutAnalyzer(), new PlaceholderTextRecognizer());
    }

    @Test
    @DisplayName("Recognizes every page in order and stores the document")
    void shouldRecognizeAllPages() {
        Session session = sessionService.create("Two pages", null);
        sessionService.addPage(session.id(), TestFixtures.png(60, 40), "a.png", PageSource.FILE, "image/png");
        sessionService.addPage(session.id(), TestFixtures.png(30, 20), "b.png", PageSource.FILE, "image/png");

        Document document = pipeline.run(session.id(), emitted::add);

        assertThat(document.pages()).extracting(DocumentPage::index).containsExactly(0, 1);
        DocumentPage first = document.pages().get(0);
        assertThat(first.width()).isEqualTo(60);
        assertThat(first.height()).isEqualTo(40);
        assertThat(first.blocks()).singleElement().satisfies(block -> {
            assertThat(block.type()).isEqualTo(BlockType.PARAGRAPH);
            assertThat(block.bbox()).isEqualTo(new BoundingBox(0, 0, 60, 40));
            assertThat(block.spans()).singleElement()
                .satisfies(span -> assertThat(span.text()).isEqualTo(PlaceholderTextRecognizer.PLACEHOLDER_TEXT));
        });

        assertThat(emitted).extracting(SessionEvent::type).containsExactly(
            SessionEventType.RECOGNITION_START,
            SessionEventType.PAGE_START, SessionEventType.PAGE_COMPLETE,
            SessionEventType.PAGE_START, SessionEventType.PAGE_COMPLETE,
            SessionEventType.RECOGNITION_FINISHED);
        assertThat(emitted.get(0).get("totalPages")).isEqualTo(2);
        assertThat(emitted.get(3).get("pageIndex")).isEqualTo(1);
        assertThat(emitted.get(5).get("pages")).isEqualTo(2);

        Session stored = sessionService.get(session.id());
        assertThat(stored.status()).isEqualTo(SessionStatus.READY);
        assertThat(stored.document()).isEqualTo(document);
    }

    @Test
    @DisplayName("Refuses to run on a session without pages")
    void shouldRejectEmptySession() {
        Session session = sessionService.create("Empty", null);

        assertThatThrownBy(() -> pipeline.run(session.id(), emitted::add)).isInstanceOf(EmptySessionException.class);
        assertThat(emitted).isEmpty();
    }

    @Test
    @DisplayName("Undecodable page bytes fail with RecognitionException")
    void shouldFailOnUndecodablePage() {
        Session session = sessionService.create("Broken", null);
        sessionService.addPage(session.id(), new byte[]{1, 2, 3, 4}, "broken.png", PageSource.FILE, "image/png");

        assertThatThrownBy(() -> pipeline.run(session.id(), emitted::add)).isInstanceOf(RecognitionException.class);
        assertThat(sessionService.get(session.id()).document()).isNull();
    }

    @Test
    @DisplayName("Stops between pages when the worker thread is interrupted")
    void shouldStopWhenInterrupted() {
        Session session = sessionService.create("Interrupted", null);
        sessionService.addPage(session.id(), TestFixtures.png(10, 10), "a.png", PageSource.FILE, "image/png");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> pipeline.run(session.id(), emitted::add)).isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(emitted).extracting(SessionEvent::type).containsExactly(SessionEventType.RECOGNITION_START);
        assertThat(sessionService.get(session.id()).document()).isNull();
    }

    @Test
    @DisplayName("Grayscale preprocessing keeps the page size")
    void shouldConvertToGrayscale() {
        BufferedImage color = new BufferedImage(7, 5, BufferedImage.TYPE_INT_RGB);

        BufferedImage gray = new GrayscalePreprocessor().process(color);

        assertThat(gray.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
        assertThat(gray.getWidth()).isEqualTo(7);
        assertThat(gray.getHeight()).isEqualTo(5);
    }
}
