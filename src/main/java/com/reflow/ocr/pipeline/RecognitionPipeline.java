package com.reflow.ocr.pipeline;

import com.reflow.ocr.exception.EmptySessionException;
import com.reflow.ocr.exception.RecognitionException;
import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.DocumentBlock;
import com.reflow.ocr.model.DocumentPage;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.SessionEventType;
import com.reflow.ocr.model.SessionPage;
import com.reflow.ocr.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Turns the pages of one session into a {@link Document}, page by page in index
 * order, reporting progress to {@code emitter}. Interruption of the calling thread is
 * honoured between pages and between blocks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecognitionPipeline {

    private final SessionService sessionService;
    private final ImagePreprocessor preprocessor;
    private final LayoutAnalyzer layoutAnalyzer;
    private final TextRecognizer textRecognizer;

    public Document run(UUID sessionId, Consumer<SessionEvent> emitter) {
        Session session = sessionService.get(sessionId);
        List<SessionPage> pages = session.pages();
        if (pages.isEmpty()) {
            throw new EmptySessionException(sessionId);
        }

        log.info("Session {}: recognizing {} pages", sessionId, pages.size());
        emitter.accept(SessionEvent.of(SessionEventType.RECOGNITION_START)
            .with("sessionId", sessionId)
            .with("totalPages", pages.size()));

        List<DocumentPage> documentPages = new ArrayList<>(pages.size());
        for (SessionPage page : pages) {
            checkCancelled(sessionId);
            emitter.accept(SessionEvent.of(SessionEventType.PAGE_START).with("pageIndex", page.index()));

            BufferedImage processed = preprocessor.process(loadImage(sessionId, page));
            List<DocumentBlock> blocks = new ArrayList<>();
            for (LayoutBlock block : layoutAnalyzer.analyze(processed)) {
                checkCancelled(sessionId);
                blocks.add(textRecognizer.recognize(processed, block));
            }
            documentPages.add(new DocumentPage(page.index(), processed.getWidth(), processed.getHeight(), blocks));

            emitter.accept(SessionEvent.of(SessionEventType.PAGE_COMPLETE).with("pageIndex", page.index()));
            log.debug("Session {}: page {} recognized ({} blocks)", sessionId, page.index(), blocks.size());
        }

        Document document = new Document(OffsetDateTime.now(ZoneOffset.UTC), Document.DEFAULT_LANGUAGE_HINT, documentPages);
        sessionService.saveDocument(sessionId, document);
        emitter.accept(SessionEvent.of(SessionEventType.RECOGNITION_FINISHED).with("pages", documentPages.size()));
        return document;
    }

    private BufferedImage loadImage(UUID sessionId, SessionPage page) {
        Path path = sessionService.pagePath(sessionId, page.id());
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new RecognitionException("Unable to read page image " + page.filename(), e);
        }
        if (image == null) {
            throw new RecognitionException("Unable to decode image at " + path);
        }
        return image;
    }

    private static void checkCancelled(UUID sessionId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Recognition cancelled for session " + sessionId);
        }
    }
}
