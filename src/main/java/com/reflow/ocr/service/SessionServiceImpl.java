package com.reflow.ocr.service;

import com.reflow.ocr.exception.PageNotFoundException;
import com.reflow.ocr.exception.SessionNotFoundException;
import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.model.Document;
import com.reflow.ocr.model.PageMetadata;
import com.reflow.ocr.model.PageSource;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionPage;
import com.reflow.ocr.model.SessionStatus;
import com.reflow.ocr.repository.PageFiles;
import com.reflow.ocr.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Registry guarded by a single lock. The lock only covers map and dirty-set
 * bookkeeping; page bytes are written before the lock is taken and manifests are
 * written by {@link #flush()} outside it.
 */
@Slf4j
@Service
public class SessionServiceImpl implements SessionService {

    static final String INTERRUPTED_MESSAGE = "Recognition interrupted";

    private static final DateTimeFormatter DEFAULT_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SessionRepository repository;

    private final Lock lock = new ReentrantLock();
    private final Map<UUID, Session> sessions = new HashMap<>();
    private final Set<UUID> dirtySessions = new LinkedHashSet<>();

    // Serializes manifest writes and directory removal so a flush never recreates a deleted session.
    private final Lock flushLock = new ReentrantLock();

    public SessionServiceImpl(SessionRepository repository) {
        this.repository = repository;
        loadStoredSessions();
    }

    private void loadStoredSessions() {
        try (Stream<Session> stored = repository.loadAll()) {
            stored.forEach(session -> {
                Session loaded = session;
                if (session.status() == SessionStatus.PROCESSING) {
                    log.warn("Session {}: recognition was interrupted, marking as error", session.id());
                    loaded = session.withStatus(SessionStatus.ERROR, INTERRUPTED_MESSAGE, now());
                    dirtySessions.add(loaded.id());
                }
                sessions.put(loaded.id(), loaded);
            });
        }
        log.info("Loaded {} sessions from storage", sessions.size());
    }

    @Override
    public List<Session> list() {
        lock.lock();
        try {
            return sessions.values().stream()
                .sorted(Comparator.comparing(Session::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Session get(UUID sessionId) {
        lock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                log.warn("Session not found for ID: {}", sessionId);
                throw new SessionNotFoundException(sessionId);
            }
            return session;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Session create(String name, String description) {
        OffsetDateTime now = now();
        String resolvedName = name == null || name.isBlank() ? "Session " + now.format(DEFAULT_NAME_FORMAT) : name;

        Session session = new Session(
            UUID.randomUUID(),
            resolvedName,
            description,
            now,
            now,
            0,
            SessionStatus.DRAFT,
            true,
            List.of(),
            null,
            null,
            null
        );
        register(session);
        log.info("Created session {} ({})", session.id(), resolvedName);
        return session;
    }

    @Override
    public Session update(UUID sessionId, String name, String description) {
        return mutate(sessionId, session -> session.withDetails(
            name == null || name.isBlank() ? session.name() : name,
            description != null ? description : session.description(),
            now()
        ));
    }

    @Override
    public void delete(UUID sessionId) {
        lock.lock();
        try {
            sessions.remove(sessionId);
            dirtySessions.remove(sessionId);
        } finally {
            lock.unlock();
        }

        flushLock.lock();
        try {
            repository.delete(sessionId);
        } finally {
            flushLock.unlock();
        }
        log.info("Deleted session {}", sessionId);
    }

    @Override
    public Session addPage(UUID sessionId, byte[] data, String originalName, PageSource source, String mimetype) {
        get(sessionId);

        UUID pageId = UUID.randomUUID();
        String filename = PageFiles.filenameFor(pageId, originalName, mimetype);
        repository.writePage(sessionId, filename, data);
        PageMetadata metadata = PageImages.inspect(data, mimetype);
        String displayName = originalName == null || originalName.isBlank() ? filename : originalName;

        try {
            Session updated = mutate(sessionId, session -> {
                OffsetDateTime now = now();
                List<SessionPage> pages = new ArrayList<>(session.pages());
                pages.add(new SessionPage(pageId, pages.size(), filename, displayName, source, metadata, now, now));
                return session.withPages(pages, now);
            });
            log.debug("Session {}: added page {} ({} bytes)", sessionId, pageId, data.length);
            return updated;
        } catch (SessionNotFoundException e) {
            log.warn("Session {} was deleted during page upload, discarding {}", sessionId, filename);
            discardOrphanedStorage(sessionId);
            throw e;
        }
    }

    private void discardOrphanedStorage(UUID sessionId) {
        flushLock.lock();
        try {
            repository.delete(sessionId);
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Unknown page ids leave the session untouched. The page file is removed after the
     * registry no longer references it.
     */
    @Override
    public Session removePage(UUID sessionId, UUID pageId) {
        List<String> removed = new ArrayList<>(1);
        Session updated = mutate(sessionId, session -> {
            List<SessionPage> remaining = new ArrayList<>(session.pages().size());
            for (SessionPage page : session.pages()) {
                if (page.id().equals(pageId)) {
                    removed.add(page.filename());
                } else {
                    remaining.add(page);
                }
            }
            if (removed.isEmpty()) {
                return session;
            }
            OffsetDateTime now = now();
            return session.withPages(reindex(remaining, now), now);
        });
        removed.forEach(filename -> repository.deletePage(sessionId, filename));
        return updated;
    }

    /**
     * Unknown and repeated ids are ignored. Pages missing from {@code order} keep their
     * relative order after the named ones.
     */
    @Override
    public Session reorderPages(UUID sessionId, List<UUID> order) {
        return mutate(sessionId, session -> {
            Map<UUID, SessionPage> byId = new LinkedHashMap<>();
            session.pages().forEach(page -> byId.put(page.id(), page));

            List<SessionPage> reordered = new ArrayList<>(byId.size());
            for (UUID pageId : order) {
                SessionPage page = byId.remove(pageId);
                if (page != null) {
                    reordered.add(page);
                } else {
                    log.debug("Session {}: ignoring unknown page {} in reorder", sessionId, pageId);
                }
            }
            reordered.addAll(byId.values());

            OffsetDateTime now = now();
            return session.withPages(reindex(reordered, now), now);
        });
    }

    @Override
    public Path pagePath(UUID sessionId, UUID pageId) {
        return repository.pagePath(sessionId, findPage(sessionId, pageId).filename());
    }

    @Override
    public byte[] readPage(UUID sessionId, UUID pageId) {
        SessionPage page = findPage(sessionId, pageId);
        return repository.readPage(sessionId, page.filename())
            .orElseThrow(() -> new StorageException("Page file missing: " + page.filename()));
    }

    private SessionPage findPage(UUID sessionId, UUID pageId) {
        return get(sessionId).pages().stream()
            .filter(page -> page.id().equals(pageId))
            .findFirst()
            .orElseThrow(() -> new PageNotFoundException(sessionId, pageId));
    }

    @Override
    public Session markProcessing(UUID sessionId) {
        return mutate(sessionId, session -> session.withStatus(SessionStatus.PROCESSING, null, now()));
    }

    @Override
    public Session markError(UUID sessionId, String message) {
        log.info("Session {}: status -> error ({})", sessionId, message);
        return mutate(sessionId, session -> session.withStatus(SessionStatus.ERROR, message, now()));
    }

    @Override
    public Session saveDocument(UUID sessionId, Document document) {
        log.info("Session {}: status -> ready", sessionId);
        return mutate(sessionId, session -> session.withDocument(document, now()));
    }

    /**
     * Inserts a fully formed session, replacing any snapshot with the same id.
     */
    @Override
    public Session register(Session session) {
        lock.lock();
        try {
            sessions.put(session.id(), session);
            dirtySessions.add(session.id());
        } finally {
            lock.unlock();
        }
        return session;
    }

    /**
     * Writes the current snapshot of every dirty session. Sessions whose write failed
     * stay dirty for the next flush, and the failure is rethrown once all others are
     * written.
     *
     * @return number of manifests written
     */
    @Override
    public int flush() {
        flushLock.lock();
        try {
            List<Session> pending;
            lock.lock();
            try {
                pending = dirtySessions.stream()
                    .map(sessions::get)
                    .filter(Objects::nonNull)
                    .toList();
                dirtySessions.clear();
            } finally {
                lock.unlock();
            }

            StorageException failure = null;
            int written = 0;
            for (Session session : pending) {
                try {
                    repository.save(session);
                    written++;
                } catch (StorageException e) {
                    log.error("Session {}: autosave failed, will retry", session.id(), e);
                    remarkDirty(session.id());
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
            if (written > 0) {
                log.debug("Flushed {} session manifests", written);
            }
            if (failure != null) {
                throw failure;
            }
            return written;
        } finally {
            flushLock.unlock();
        }
    }

    private void remarkDirty(UUID sessionId) {
        lock.lock();
        try {
            if (sessions.containsKey(sessionId)) {
                dirtySessions.add(sessionId);
            }
        } finally {
            lock.unlock();
        }
    }

    private Session mutate(UUID sessionId, UnaryOperator<Session> change) {
        lock.lock();
        try {
            Session current = sessions.get(sessionId);
            if (current == null) {
                log.warn("Session not found for ID: {}", sessionId);
                throw new SessionNotFoundException(sessionId);
            }
            Session updated = change.apply(current);
            if (updated != current) {
                sessions.put(sessionId, updated);
                dirtySessions.add(sessionId);
            }
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private static List<SessionPage> reindex(List<SessionPage> pages, OffsetDateTime now) {
        List<SessionPage> result = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            result.add(pages.get(i).withIndex(i, now));
        }
        return result;
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
