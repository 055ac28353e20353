package io.catena.core.checkpoint;

import io.catena.core.exception.CheckpointIntegrityException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/// Checkpoint store keeping one file per execution in a directory.
///
/// Each record is written as `<executionId>.checkpoint`, a properties document with
/// the keys `executionId`, `payload` (base64), `digest` and `createdAt` (ISO-8601).
///
/// ### Contracts
/// - **Atomic**: a record is written to a temp file in the same directory and moved
///   over the previous one, so readers never see a partial record
/// - **Private**: files are created `rw-------` on file systems that support POSIX
///   permissions
/// - **Idempotent delete**: deleting a missing record returns false
///
/// Write, list and delete failures surface as {@link UncheckedIOException}. A file that
/// cannot be read or parsed is reported as a {@link CheckpointIntegrityException}, like a
/// tampered record.
public final class FileCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(FileCheckpointStore.class.getName());

    static final String SUFFIX = ".checkpoint";

    private static final String KEY_EXECUTION_ID = "executionId";
    private static final String KEY_PAYLOAD = "payload";
    private static final String KEY_DIGEST = "digest";
    private static final String KEY_CREATED_AT = "createdAt";

    private static final Set<PosixFilePermission> OWNER_ONLY =
            PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final boolean posix;

    /// Creates a store rooted at `directory`, creating it if needed.
    ///
    /// @param directory checkpoint directory, not null
    /// @throws UncheckedIOException if the directory cannot be created
    public FileCheckpointStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create checkpoint directory " + directory, e);
        }
    }

    @Override
    public void save(CheckpointRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Properties properties = new Properties();
        properties.setProperty(KEY_EXECUTION_ID, record.executionId());
        properties.setProperty(
                KEY_PAYLOAD, Base64.getEncoder().encodeToString(record.encryptedPayload()));
        properties.setProperty(KEY_DIGEST, record.integrityDigest());
        properties.setProperty(KEY_CREATED_AT, record.createdAt().toString());

        Path target = pathFor(record.executionId());
        Path temp = null;
        try {
            temp = createTempFile(record.executionId());
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                properties.store(writer, null);
            }
            move(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new UncheckedIOException("Cannot write checkpoint " + target, e);
        }
    }

    @Override
    public Optional<CheckpointRecord> find(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Path file = pathFor(executionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new CheckpointIntegrityException(executionId, "unreadable file " + file, e);
        } catch (IllegalArgumentException e) {
            throw new CheckpointIntegrityException(executionId, "malformed file " + file, e);
        }
        return Optional.of(parse(executionId, properties));
    }

    @Override
    public List<String> list() {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list checkpoints in " + directory, e);
        }
        return List.copyOf(ids);
    }

    @Override
    public boolean delete(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        try {
            return Files.deleteIfExists(pathFor(executionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete checkpoint " + executionId, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    Path pathFor(String executionId) {
        return directory.resolve(executionId + SUFFIX);
    }

    private static CheckpointRecord parse(String executionId, Properties properties) {
        String storedId = properties.getProperty(KEY_EXECUTION_ID);
        String payload = properties.getProperty(KEY_PAYLOAD);
        String digest = properties.getProperty(KEY_DIGEST);
        String createdAt = properties.getProperty(KEY_CREATED_AT);
        if (storedId == null || payload == null || digest == null || createdAt == null) {
            throw new CheckpointIntegrityException(executionId, "missing fields");
        }
        if (!storedId.equals(executionId)) {
            throw new CheckpointIntegrityException(
                    executionId, "file holds execution " + storedId);
        }
        try {
            return new CheckpointRecord(
                    storedId,
                    Base64.getDecoder().decode(payload),
                    digest,
                    Instant.parse(createdAt));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new CheckpointIntegrityException(executionId, "malformed record", e);
        }
    }

    private Path createTempFile(String executionId) throws IOException {
        if (posix) {
            FileAttribute<Set<PosixFilePermission>> attribute =
                    PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            return Files.createTempFile(directory, executionId, ".tmp", attribute);
        }
        return Files.createTempFile(directory, executionId, ".tmp");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(
                    source,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warning("Atomic move not supported, replacing " + target + " non-atomically");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException cause) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
