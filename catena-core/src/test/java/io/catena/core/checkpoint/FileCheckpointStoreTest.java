package io.catena.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.catena.core.exception.CheckpointIntegrityException;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCheckpointStoreTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir Path directory;

    private FileCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new FileCheckpointStore(directory.resolve("checkpoints"));
    }

    @Test
    void shouldPersistRecordAcrossInstances() {
        // Given
        var record = new CheckpointRecord("exec-1", new byte[] {1, 2, 3}, "abc", CREATED);
        store.save(record);

        // When
        var reopened = new FileCheckpointStore(store.getDirectory());

        // Then
        assertThat(reopened.find("exec-1")).contains(record);
        assertThat(reopened.list()).containsExactly("exec-1");
    }

    @Test
    void shouldReplaceExistingRecordWithoutLeavingTempFiles() throws IOException {
        store.save(new CheckpointRecord("exec-1", new byte[] {1}, "a", CREATED));
        store.save(new CheckpointRecord("exec-1", new byte[] {2}, "b", CREATED));

        assertThat(store.find("exec-1").orElseThrow().integrityDigest()).isEqualTo("b");
        try (var files = Files.list(store.getDirectory())) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void shouldWriteOwnerOnlyFiles() throws IOException {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        store.save(new CheckpointRecord("exec-1", new byte[] {1}, "a", CREATED));

        assertThat(Files.getPosixFilePermissions(store.pathFor("exec-1")))
                .containsExactlyInAnyOrder(
                        PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);
    }

    @Test
    void shouldReturnEmptyForMissingRecord() {
        assertThat(store.find("exec-missing")).isEmpty();
        assertThat(store.delete("exec-missing")).isFalse();
    }

    @Test
    void shouldDeleteRecord() {
        store.save(new CheckpointRecord("exec-1", new byte[] {1}, "a", CREATED));

        assertThat(store.delete("exec-1")).isTrue();
        assertThat(store.list()).isEmpty();
    }

    @Test
    void shouldRejectMalformedFile() throws IOException {
        Files.writeString(store.pathFor("exec-1"), "executionId=exec-1\npayload=@@@\n");

        assertThatThrownBy(() -> store.find("exec-1"))
                .isInstanceOf(CheckpointIntegrityException.class)
                .hasMessageContaining("missing fields");
    }

    @Test
    void shouldReportBrokenEscapeAsIntegrityFailure() throws IOException {
        Files.writeString(store.pathFor("exec-1"), "executionId=exec-1\npayload=\\u00zz\n");

        assertThatThrownBy(() -> store.find("exec-1"))
                .isInstanceOf(CheckpointIntegrityException.class)
                .hasMessageContaining("malformed file");
    }

    @Test
    void shouldReportUnreadableEntryAsIntegrityFailure() throws IOException {
        Files.createDirectory(store.pathFor("exec-dir"));

        assertThatThrownBy(() -> store.find("exec-dir"))
                .isInstanceOf(CheckpointIntegrityException.class)
                .hasMessageContaining("unreadable file");
    }

    @Test
    void shouldRejectFileHoldingAnotherExecution() throws IOException {
        store.save(new CheckpointRecord("exec-1", new byte[] {1}, "a", CREATED));
        Files.copy(store.pathFor("exec-1"), store.pathFor("exec-2"));

        assertThatThrownBy(() -> store.find("exec-2"))
                .isInstanceOf(CheckpointIntegrityException.class)
                .hasMessageContaining("holds execution exec-1");
    }
}
