package com.reflow.ocr.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.model.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Lays sessions out as {@code sessions/<id>/session.json} plus
 * {@code sessions/<id>/pages/<file>} under the configured data directory.
 */
@Slf4j
@Repository
public class FileSystemSessionRepository implements SessionRepository {

    public static final String MANIFEST_FILE = "session.json";
    public static final String PAGES_DIR = "pages";

    private final Path sessionsDir;
    private final ObjectMapper objectMapper;

    public FileSystemSessionRepository(StorageProperties properties, ObjectMapper objectMapper) {
        this.sessionsDir = properties.sessionsDir();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(sessionsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create sessions directory " + sessionsDir, e);
        }
    }

    @Override
    public Stream<Session> loadAll() {
        Stream<Path> children;
        try {
            children = Files.list(sessionsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot list sessions directory " + sessionsDir, e);
        }
        return children
            .filter(Files::isDirectory)
            .map(this::readManifest)
            .flatMap(Optional::stream);
    }

    private Optional<Session> readManifest(Path sessionDir) {
        Path manifest = sessionDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            log.debug("Skipping {}: no manifest", sessionDir.getFileName());
            return Optional.empty();
        }
        try {
            Session session = objectMapper.readValue(manifest.toFile(), Session.class);
            if (session == null) {
                log.warn("Skipping empty session manifest {}", manifest);
                return Optional.empty();
            }
            List<String> missing = session.missingRequiredFields();
            if (!missing.isEmpty()) {
                log.warn("Skipping session manifest {}: missing {}", manifest, missing);
                return Optional.empty();
            }
            return Optional.of(session);
        } catch (IOException e) {
            log.warn("Skipping unreadable session manifest {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Session session) {
        Path dir = sessionDir(session.id());
        Path manifest = dir.resolve(MANIFEST_FILE);
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, MANIFEST_FILE, ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), session);
                moveReplacing(tmp, manifest);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save session " + session.id(), e);
        }
        log.debug("Session {}: manifest written", session.id());
    }

    private void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void delete(UUID sessionId) {
        try {
            if (FileSystemUtils.deleteRecursively(sessionDir(sessionId))) {
                log.info("Session {}: storage removed", sessionId);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete session " + sessionId, e);
        }
    }

    @Override
    public Path pagePath(UUID sessionId, String filename) {
        return sessionDir(sessionId).resolve(PAGES_DIR).resolve(filename);
    }

    @Override
    public void writePage(UUID sessionId, String filename, byte[] data) {
        Path target = pagePath(sessionId, filename);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
        } catch (IOException e) {
            throw new StorageException("Failed to write page " + filename + " of session " + sessionId, e);
        }
    }

    @Override
    public Optional<byte[]> readPage(UUID sessionId, String filename) {
        Path source = pagePath(sessionId, filename);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(source));
        } catch (IOException e) {
            throw new StorageException("Failed to read page " + filename + " of session " + sessionId, e);
        }
    }

    @Override
    public void deletePage(UUID sessionId, String filename) {
        try {
            Files.deleteIfExists(pagePath(sessionId, filename));
        } catch (IOException e) {
            throw new StorageException("Failed to delete page " + filename + " of session " + sessionId, e);
        }
    }

    private Path sessionDir(UUID sessionId) {
        return sessionsDir.resolve(sessionId.toString());
    }
}
