package io.catena.core.checkpoint;

import io.catena.core.exception.ValidationException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/// AES-256 key used to encrypt checkpoint payloads.
///
/// The key is supplied out-of-band as 64 hex characters, either through the
/// `CATENA_CHECKPOINT_KEY` environment variable or through configuration. The key
/// material never appears in `toString()`.
public final class CheckpointKey {

    /// Environment variable holding the hex-encoded key.
    public static final String ENV_VARIABLE = "CATENA_CHECKPOINT_KEY";

    private static final int KEY_BYTES = 32;

    private final SecretKey secretKey;

    private CheckpointKey(byte[] material) {
        this.secretKey = new SecretKeySpec(material, "AES");
    }

    /// Parses a hex-encoded 256-bit key.
    ///
    /// @param hex 64 hex characters, not null
    /// @return the key, never null
    /// @throws ValidationException if the value is not 64 hex characters
    public static CheckpointKey fromHex(String hex) {
        Objects.requireNonNull(hex, "hex must not be null");
        String trimmed = hex.trim();
        if (trimmed.length() != KEY_BYTES * 2) {
            throw new ValidationException(
                    "Checkpoint key must be " + (KEY_BYTES * 2) + " hex characters");
        }
        try {
            return new CheckpointKey(HexFormat.of().parseHex(trimmed));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Checkpoint key must be hex-encoded");
        }
    }

    /// Reads the key from an environment map.
    ///
    /// @param env environment variables, not null
    /// @return the key, empty if the variable is unset or blank
    /// @throws ValidationException if the variable is set but malformed
    public static Optional<CheckpointKey> fromEnvironment(Map<String, String> env) {
        String value = env.get(ENV_VARIABLE);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(fromHex(value));
    }

    /// Generates a random key. Checkpoints written with it are unreadable after a restart.
    public static CheckpointKey random() {
        byte[] material = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(material);
        return new CheckpointKey(material);
    }

    SecretKey secretKey() {
        return secretKey;
    }

    @Override
    public String toString() {
        return "CheckpointKey[AES-256]";
    }
}
