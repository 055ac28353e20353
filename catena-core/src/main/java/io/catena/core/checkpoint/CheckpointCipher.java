package io.catena.core.checkpoint;

import io.catena.core.exception.CheckpointIntegrityException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

/// AES-256-GCM encryption of checkpoint payloads.
///
/// Output layout is `IV || ciphertext+tag` with a fresh 12-byte random IV per call and
/// a 128-bit tag. The execution id is bound as associated data, so a record copied
/// under another execution's name fails to decrypt.
public final class CheckpointCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final CheckpointKey key;
    private final SecureRandom random = new SecureRandom();

    public CheckpointCipher(CheckpointKey key) {
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    /// Encrypts a plaintext payload.
    ///
    /// @param executionId execution the payload belongs to, not null
    /// @param plaintext payload bytes, not null
    /// @return `IV || ciphertext+tag`, never null
    /// @throws IllegalStateException if the JCE provider rejects AES-GCM
    public byte[] encrypt(String executionId, byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(executionId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext);

            byte[] out = new byte[IV_LENGTH + sealed.length];
            System.arraycopy(iv, 0, out, 0, IV_LENGTH);
            System.arraycopy(sealed, 0, out, IV_LENGTH, sealed.length);
            return out;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    /// Decrypts and authenticates a payload.
    ///
    /// @param executionId execution the payload belongs to, not null
    /// @param encrypted `IV || ciphertext+tag`, not null
    /// @return plaintext bytes, never null
    /// @throws CheckpointIntegrityException if the payload is truncated, tampered with or
    ///     encrypted under another key
    public byte[] decrypt(String executionId, byte[] encrypted) {
        if (encrypted.length < IV_LENGTH + TAG_BITS / 8) {
            throw new CheckpointIntegrityException(executionId, "payload too short");
        }
        byte[] iv = Arrays.copyOfRange(encrypted, 0, IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key.secretKey(), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(executionId.getBytes(StandardCharsets.UTF_8));
            return cipher.doFinal(encrypted, IV_LENGTH, encrypted.length - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CheckpointIntegrityException(executionId, "decryption failed", e);
        }
    }
}
