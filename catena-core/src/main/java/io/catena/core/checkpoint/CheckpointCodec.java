package io.catena.core.checkpoint;

/// Converts checkpoints to plaintext bytes and back.
///
/// The core ships no implementation; `catena-serialization` provides a JSON codec.
/// Codecs must round-trip the context (including variables, depth and retry count),
/// the next index, every step result and the status.
public interface CheckpointCodec {

    /// Serializes a checkpoint.
    ///
    /// @param checkpoint checkpoint to encode, not null
    /// @return plaintext bytes, never null
    byte[] encode(Checkpoint checkpoint);

    /// Deserializes a checkpoint.
    ///
    /// @param payload plaintext bytes, not null
    /// @return decoded checkpoint, never null
    /// @throws IllegalArgumentException if the payload is not a valid checkpoint
    Checkpoint decode(byte[] payload);
}
