package com.reflow.ocr.repository;

import com.reflow.ocr.TestFixtures;
import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.model.Session;
import com.reflow.ocr.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemSessionRepositoryTest {

    @TempDir
    Path dataDir;

    private FileSystemSessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileSystemSessionRepository(TestFixtures.storage(dataDir), TestFixtures.objectMapper());
    }

    @Test
    @DisplayName("Should write a snake_case manifest and read it back")
    void shouldPersistManifest() throws IOException {
        Session session = session("Contract");

        repository.save(session);

        Path manifest = dataDir.resolve("sessions").resolve(session.id().toString()).resolve("session.json");
        assertThat(manifest).exists();
        assertThat(Files.readString(manifest)).contains("\"page_count\"", "\"autosave_enabled\"", "\"draft\"");

        assertThat(loadAll()).singleElement().satisfies(loaded -> {
            assertThat(loaded.id()).isEqualTo(session.id());
            assertThat(loaded.name()).isEqualTo("Contract");
            assertThat(loaded.status()).isEqualTo(SessionStatus.DRAFT);
        });
    }

    @Test
    @DisplayName("Should skip directories with a corrupt or missing manifest")
    void shouldSkipBrokenSessions() throws IOException {
        Session valid = session("Valid");
        repository.save(valid);

        Path corrupt = dataDir.resolve("sessions").resolve(UUID.randomUUID().toString());
        Files.createDirectories(corrupt);
        Files.writeString(corrupt.resolve("session.json"), "{ not json");
        Files.createDirectories(dataDir.resolve("sessions").resolve(UUID.randomUUID().toString()).resolve("pages"));

        assertThat(loadAll()).extracting(Session::id).containsExactly(valid.id());
    }

    @Test
    @DisplayName("Should skip manifests that parse but lack required fields")
    void shouldSkipIncompleteManifests() throws IOException {
        Session valid = session("Valid");
        repository.save(valid);

        UUID incompleteId = UUID.randomUUID();
        writeManifest(UUID.randomUUID(), "null");
        writeManifest(incompleteId, "{\"id\":\"" + incompleteId + "\",\"name\":\"broken\"}");
        writeManifest(UUID.randomUUID(), "{\"name\":\"no id\",\"created_at\":\"2024-01-01T00:00:00Z\",\"status\":\"draft\"}");

        assertThat(loadAll()).extracting(Session::id).containsExactly(valid.id());
    }

    @Test
    @DisplayName("Should store, read and delete page bytes")
    void shouldHandlePageFiles() {
        UUID sessionId = UUID.randomUUID();
        byte[] bytes = {1, 2, 3};

        repository.writePage(sessionId, "p.png", bytes);
        assertThat(repository.readPage(sessionId, "p.png").orElseThrow()).containsExactly(bytes);
        assertThat(repository.pagePath(sessionId, "p.png")).exists();

        repository.deletePage(sessionId, "p.png");
        assertThat(repository.readPage(sessionId, "p.png")).isEmpty();
    }

    @Test
    @DisplayName("Should remove the whole session directory and tolerate repeated deletes")
    void shouldDeleteSessionDirectory() {
        Session session = session("Gone");
        repository.save(session);
        repository.writePage(session.id(), "p.png", new byte[]{1});

        repository.delete(session.id());
        repository.delete(session.id());

        assertThat(dataDir.resolve("sessions").resolve(session.id().toString())).doesNotExist();
        assertThat(loadAll()).isEmpty();
    }

    @Test
    @DisplayName("Should surface I/O failures as StorageException")
    void shouldWrapIoFailures() throws IOException {
        UUID sessionId = UUID.randomUUID();
        // a regular file where the session directory should be
        Files.writeString(dataDir.resolve("sessions").resolve(sessionId.toString()), "blocker");

        assertThatThrownBy(() -> repository.writePage(sessionId, "p.png", new byte[]{1}))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining(sessionId.toString());
    }

    private void writeManifest(UUID sessionId, String json) throws IOException {
        Path dir = dataDir.resolve("sessions").resolve(sessionId.toString());
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("session.json"), json);
    }

    private List<Session> loadAll() {
        try (Stream<Session> stored = repository.loadAll()) {
            return stored.toList();
        }
    }

    private static Session session(String name) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return new Session(UUID.randomUUID(), name, null, now, now, 0, SessionStatus.DRAFT, true,
            List.of(), null, null, null);
    }
}
