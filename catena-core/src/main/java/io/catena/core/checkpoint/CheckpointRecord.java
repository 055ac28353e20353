package io.catena.core.checkpoint;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/// Persisted form of a checkpoint.
///
/// The payload is the encrypted codec output; the digest is the hex SHA-256 of the
/// plaintext and is verified after decryption.
///
/// @param executionId sanitized execution identifier, not null
/// @param encryptedPayload `IV || ciphertext+tag`, not null
/// @param integrityDigest hex SHA-256 of the plaintext payload, not null
/// @param createdAt when the record was written, not null
public record CheckpointRecord(
        String executionId, byte[] encryptedPayload, String integrityDigest, Instant createdAt) {

    public CheckpointRecord {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(encryptedPayload, "encryptedPayload must not be null");
        Objects.requireNonNull(integrityDigest, "integrityDigest must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        encryptedPayload = encryptedPayload.clone();
    }

    @Override
    public byte[] encryptedPayload() {
        return encryptedPayload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckpointRecord other)) {
            return false;
        }
        return executionId.equals(other.executionId)
                && Arrays.equals(encryptedPayload, other.encryptedPayload)
                && integrityDigest.equals(other.integrityDigest)
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                executionId, Arrays.hashCode(encryptedPayload), integrityDigest, createdAt);
    }

    @Override
    public String toString() {
        return "CheckpointRecord{executionId="
                + executionId
                + ", payloadBytes="
                + encryptedPayload.length
                + ", createdAt="
                + createdAt
                + "}";
    }
}
