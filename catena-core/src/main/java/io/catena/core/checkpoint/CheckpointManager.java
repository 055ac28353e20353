package io.catena.core.checkpoint;

import io.catena.core.exception.CheckpointIntegrityException;
import io.catena.core.execution.ExecutionContext;
import io.catena.core.execution.ExecutionIds;
import io.catena.core.execution.StepResult;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Encrypts, persists and restores execution checkpoints.
///
/// ### Write path
/// checkpoint → {@link CheckpointCodec#encode} → SHA-256 digest of the plaintext →
/// {@link CheckpointCipher#encrypt} → {@link CheckpointStore#save}
///
/// ### Read path
/// {@link CheckpointStore#find} → decrypt → digest check → {@link CheckpointCodec#decode}
///
/// Any failure on the read path after the record was found raises
/// {@link CheckpointIntegrityException}; a wrong context is never returned.
///
/// ### Contracts
/// - **Sanitized ids**: every execution id passes {@link ExecutionIds#sanitize} before it
///   reaches the store
/// - **Superseding**: each save replaces the previous checkpoint of the execution
///
/// @implNote Thread-safe as long as the store is. Saves for one execution come from the
/// single worker running it, so they are naturally ordered.
public class CheckpointManager {

    private static final Logger logger = Logger.getLogger(CheckpointManager.class.getName());

    private final CheckpointStore store;
    private final CheckpointCodec codec;
    private final CheckpointCipher cipher;
    private final Clock clock;

    public CheckpointManager(
            CheckpointStore store, CheckpointCodec codec, CheckpointCipher cipher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Persists the state of a running execution.
    ///
    /// @param context execution context after the last committed step, not null
    /// @param nextIndex index of the next step to run
    /// @param results results recorded so far, not null
    /// @return the checkpoint that was written, never null
    /// @throws io.catena.core.exception.ValidationException if the execution id is not
    ///     allow-listed
    public Checkpoint save(ExecutionContext context, int nextIndex, List<StepResult> results) {
        Objects.requireNonNull(context, "context must not be null");
        Checkpoint checkpoint =
                new Checkpoint(
                        context, nextIndex, results, CheckpointStatus.RUNNING, clock.instant());
        write(checkpoint);
        return checkpoint;
    }

    /// Re-writes an existing checkpoint with status `CANCELLED`.
    ///
    /// @param executionId execution id, not null
    /// @return true if a checkpoint existed and was marked
    /// @throws CheckpointIntegrityException if the stored checkpoint is unusable
    public boolean markCancelled(String executionId) {
        Optional<Checkpoint> existing = load(executionId);
        existing.ifPresent(checkpoint -> write(checkpoint.withStatus(CheckpointStatus.CANCELLED)));
        return existing.isPresent();
    }

    /// Loads and verifies the checkpoint of an execution.
    ///
    /// @param executionId execution id, not null
    /// @return the checkpoint, empty if none is stored
    /// @throws CheckpointIntegrityException if decryption, digest check or decoding fails
    /// @throws io.catena.core.exception.ValidationException if the id is not allow-listed
    public Optional<Checkpoint> load(String executionId) {
        String id = ExecutionIds.sanitize(executionId);
        Optional<CheckpointRecord> found = store.find(id);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        CheckpointRecord record = found.get();
        byte[] plaintext = cipher.decrypt(id, record.encryptedPayload());
        String digest = digest(plaintext);
        if (!MessageDigest.isEqual(
                digest.getBytes(StandardCharsets.US_ASCII),
                record.integrityDigest().getBytes(StandardCharsets.US_ASCII))) {
            throw new CheckpointIntegrityException(id, "integrity digest mismatch");
        }

        Checkpoint checkpoint;
        try {
            checkpoint = codec.decode(plaintext);
        } catch (IllegalArgumentException e) {
            throw new CheckpointIntegrityException(id, "payload cannot be decoded", e);
        }
        if (!id.equals(checkpoint.executionId())) {
            throw new CheckpointIntegrityException(
                    id, "payload belongs to execution " + checkpoint.executionId());
        }
        return Optional.of(checkpoint);
    }

    /// Lists the ids of all stored checkpoints, sorted.
    ///
    /// @return execution ids, never null
    public List<String> list() {
        return store.list().stream().sorted().toList();
    }

    /// Deletes the checkpoint of an execution. Idempotent.
    ///
    /// @param executionId execution id, not null
    /// @return true if a checkpoint was removed
    public boolean delete(String executionId) {
        boolean removed = store.delete(ExecutionIds.sanitize(executionId));
        if (removed) {
            logger.fine("Deleted checkpoint of execution " + executionId);
        }
        return removed;
    }

    private void write(Checkpoint checkpoint) {
        String id = ExecutionIds.sanitize(checkpoint.executionId());
        byte[] plaintext = codec.encode(checkpoint);
        byte[] encrypted = cipher.encrypt(id, plaintext);
        CheckpointRecord record =
                new CheckpointRecord(id, encrypted, digest(plaintext), checkpoint.createdAt());
        store.save(record);
        logger.fine(
                "Checkpointed execution "
                        + id
                        + " at step index "
                        + checkpoint.nextIndex()
                        + " ("
                        + checkpoint.status().wireName()
                        + ")");
    }

    static String digest(byte[] plaintext) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(plaintext));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
