package io.catena.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.catena.core.chain.ChainDefinition;

/// Reads and writes chain definitions as JSON.
///
/// ### Usage
/// {@snippet :
/// String json = ChainSerializer.toJson(chain);
/// ChainDefinition restored = ChainSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`; callers
/// on a hot path should cache their own.
///
/// @see CatenaJacksonModule for the registered type handlers
public final class ChainSerializer {

    private ChainSerializer() {}

    /// Serializes a chain to pretty-printed JSON.
    ///
    /// @param chain the chain to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ChainDefinition chain) {
        try {
            return createMapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(chain);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize chain: " + e.getMessage(), e);
        }
    }

    /// Deserializes and validates a chain.
    ///
    /// @param json JSON string, not null
    /// @return the chain, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    /// @throws io.catena.core.exception.ValidationException if the chain breaks a
    ///     definition rule
    public static ChainDefinition fromJson(String json) {
        try {
            return createMapper().readValue(json, ChainDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize chain: " + e.getOriginalMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Catena types.
    ///
    /// Registers:
    /// - `CatenaJacksonModule` for chain, context and result types
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new CatenaJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
