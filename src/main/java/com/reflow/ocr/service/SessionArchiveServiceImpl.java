package com.reflow.ocr.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.exception.InvalidArchiveException;
import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionPage;
import com.reflow.ocr.model.SessionStatus;
import com.reflow.ocr.repository.PageFiles;
import com.reflow.ocr.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionArchiveServiceImpl implements SessionArchiveService {

    static final String MANIFEST_ENTRY = "session.json";
    static final String PAGES_PREFIX = "pages/";
    static final String IMPORTED_SUFFIX = " (imported)";

    private final SessionService sessionService;
    private final SessionRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Path exportArchive(UUID sessionId) {
        Session session = sessionService.get(sessionId);
        Path archive = null;
        try {
            archive = Files.createTempFile("session-", ARCHIVE_SUFFIX);
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(archive))) {
                zip.setMethod(ZipOutputStream.DEFLATED);
                writeEntry(zip, MANIFEST_ENTRY, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(session));
                for (SessionPage page : session.pages()) {
                    Path pagePath = repository.pagePath(sessionId, page.filename());
                    if (!Files.exists(pagePath)) {
                        log.warn("Session {}: page file {} is missing, leaving it out of the archive", sessionId, page.filename());
                        continue;
                    }
                    zip.putNextEntry(new ZipEntry(PAGES_PREFIX + page.filename()));
                    Files.copy(pagePath, zip);
                    zip.closeEntry();
                }
            }
            log.info("Session {}: exported archive with {} pages", sessionId, session.pageCount());
            return archive;
        } catch (IOException e) {
            deleteQuietly(archive);
            throw new StorageException("Failed to export session " + sessionId, e);
        }
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }

    @Override
    public Session importArchive(byte[] archive) {
        Map<String, byte[]> entries = readEntries(archive);
        byte[] manifest = entries.get(MANIFEST_ENTRY);
        if (manifest == null) {
            throw new InvalidArchiveException("Archive missing " + MANIFEST_ENTRY);
        }
        Session source;
        try {
            source = objectMapper.readValue(manifest, Session.class);
        } catch (IOException e) {
            throw new InvalidArchiveException("Archive contains an unreadable " + MANIFEST_ENTRY, e);
        }
        if (source == null) {
            throw new InvalidArchiveException("Archive contains an empty " + MANIFEST_ENTRY);
        }
        List<String> missing = source.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new InvalidArchiveException("Archive " + MANIFEST_ENTRY + " is missing " + String.join(", ", missing));
        }

        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        UUID newId = UUID.randomUUID();
        List<SessionPage> pages = new ArrayList<>(source.pages().size());
        try {
            for (SessionPage page : source.pages()) {
                UUID pageId = UUID.randomUUID();
                String mimetype = page.metadata() != null ? page.metadata().mimetype() : null;
                String filename = pageId + PageFiles.resolveExtension(page.filename(), mimetype);
                byte[] bytes = entries.get(PAGES_PREFIX + page.filename());
                if (bytes == null) {
                    log.warn("Archive has no image for page {}, importing it empty", page.filename());
                    bytes = new byte[0];
                }
                repository.writePage(newId, filename, bytes);
                pages.add(new SessionPage(pageId, pages.size(), filename, page.originalName(), page.sourceType(),
                    page.metadata(), now, now));
            }
        } catch (StorageException e) {
            repository.delete(newId);
            throw e;
        }

        Session imported = new Session(
            newId,
            source.name() + IMPORTED_SUFFIX,
            source.description(),
            now,
            now,
            pages.size(),
            SessionStatus.DRAFT,
            source.autosaveEnabled(),
            pages,
            null,
            null,
            null
        );
        sessionService.register(imported);
        log.info("Imported session {} as {} with {} pages", source.id(), newId, pages.size());
        return imported;
    }

    private static Map<String, byte[]> readEntries(byte[] archive) {
        Map<String, byte[]> entries = new HashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    entries.put(entry.getName(), zip.readAllBytes());
                }
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new InvalidArchiveException("Payload is not a valid zip archive", e);
        }
        return entries;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Unable to remove partial archive {}", file, e);
        }
    }
}
