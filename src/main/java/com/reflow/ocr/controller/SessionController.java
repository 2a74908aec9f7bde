package com.reflow.ocr.controller;

import com.reflow.ocr.exception.DocumentNotFoundException;
import com.reflow.ocr.exception.PageNotFoundException;
import com.reflow.ocr.export.ExportFormat;
import com.reflow.ocr.export.ExportResult;
import com.reflow.ocr.export.ExporterRegistry;
import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.PageSource;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionPage;
import com.reflow.ocr.service.RecognitionService;
import com.reflow.ocr.service.SessionArchiveService;
import com.reflow.ocr.service.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    static final String DEFAULT_PAGE_NAME = "page.png";
    static final MediaType ZIP = MediaType.parseMediaType("application/zip");

    private final SessionService sessionService;
    private final SessionArchiveService archiveService;
    private final RecognitionService recognitionService;
    private final ExporterRegistry exporterRegistry;

    @GetMapping
    public List<SessionSummaryResponse> listSessions() {
        return sessionService.list().stream()
            .map(SessionSummaryResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<Session> createSession(@Valid @RequestBody(required = false) SessionCreateRequest request) {
        Session session = request == null
            ? sessionService.create(null, null)
            : sessionService.create(request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Session> getSession(@PathVariable UUID id) {
        return ResponseEntity.ok(sessionService.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Session> updateSession(@PathVariable UUID id, @Valid @RequestBody SessionUpdateRequest request) {
        return ResponseEntity.ok(sessionService.update(id, request.name(), request.description()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSession(@PathVariable UUID id) {
        sessionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/{id}/pages", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Session> uploadPages(@PathVariable UUID id, @RequestParam("files") List<MultipartFile> files)
        throws IOException {

        for (MultipartFile file : files) {
            String originalName = file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()
                ? DEFAULT_PAGE_NAME
                : file.getOriginalFilename();
            sessionService.addPage(id, file.getBytes(), originalName, PageSource.FILE, file.getContentType());
        }
        return ResponseEntity.ok(sessionService.get(id));
    }

    @PostMapping("/{id}/pages/reorder")
    public ResponseEntity<Session> reorderPages(@PathVariable UUID id, @Valid @RequestBody PageOrderRequest request) {
        return ResponseEntity.ok(sessionService.reorderPages(id, request.order()));
    }

    @DeleteMapping("/{id}/pages/{pageId}")
    public ResponseEntity<Session> removePage(@PathVariable UUID id, @PathVariable UUID pageId) {
        return ResponseEntity.ok(sessionService.removePage(id, pageId));
    }

    @GetMapping("/{id}/pages/{pageId}/image")
    public ResponseEntity<byte[]> getPageImage(@PathVariable UUID id, @PathVariable UUID pageId) {
        SessionPage page = sessionService.get(id).pages().stream()
            .filter(candidate -> candidate.id().equals(pageId))
            .findFirst()
            .orElseThrow(() -> new PageNotFoundException(id, pageId));
        byte[] image = sessionService.readPage(id, pageId);
        MediaType mediaType = MediaTypeFactory.getMediaType(page.filename()).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(mediaType).body(image);
    }

    @GetMapping("/{id}/archive")
    public ResponseEntity<StreamingResponseBody> downloadArchive(@PathVariable UUID id) {
        Path archive = archiveService.exportArchive(id);
        StreamingResponseBody body = out -> {
            try {
                Files.copy(archive, out);
            } finally {
                Files.deleteIfExists(archive);
            }
        };
        return ResponseEntity.ok()
            .contentType(ZIP)
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(id + SessionArchiveService.ARCHIVE_SUFFIX))
            .body(body);
    }

    @PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Session> importArchive(@RequestParam("file") MultipartFile file) throws IOException {
        return ResponseEntity.status(HttpStatus.CREATED).body(archiveService.importArchive(file.getBytes()));
    }

    @GetMapping("/{id}/document")
    public ResponseEntity<Document> getDocument(@PathVariable UUID id) {
        Document document = sessionService.get(id).document();
        if (document == null) {
            throw new DocumentNotFoundException(id);
        }
        return ResponseEntity.ok(document);
    }

    @PostMapping("/{id}/export")
    public ResponseEntity<byte[]> exportDocument(@PathVariable UUID id, @Valid @RequestBody ExportRequest request) {
        ExportFormat format = ExportFormat.fromWireName(request.format());
        ExportResult result = exporterRegistry.export(sessionService.get(id), format);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(result.mediaType()))
            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(result.filename()))
            .body(result.content());
    }

    @PostMapping("/{id}/recognize")
    public ResponseEntity<TaskResponse> recognize(@PathVariable UUID id) {
        UUID taskId = recognitionService.startRecognition(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskResponse(taskId));
    }

    private static String attachment(String filename) {
        return ContentDisposition.attachment().filename(filename).build().toString();
    }
}
