package io.scanflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.scanflow.core.tree.TreeSnapshot;

/// Utility class for serializing processing tree snapshots to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = TreeSerializer.toJson(tree.exportSnapshot());
///
/// ProcessingTree restored = new ProcessingTree();
/// restored.restore(TreeSerializer.fromJson(json), registry);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see ScanflowJacksonModule for the registered type handlers
/// @see JsonTreeCodec for the file based API
public final class TreeSerializer {

    private TreeSerializer() {}

    /// Serializes a snapshot to pretty-printed JSON.
    ///
    /// @param snapshot the snapshot, not null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(TreeSnapshot snapshot) {
        try {
            return createMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize processing tree: " + e.getMessage(), e);
        }
    }

    /// Deserializes a snapshot from JSON.
    ///
    /// @param json JSON string, not null
    /// @return snapshot, never null
    /// @throws IllegalArgumentException if the JSON is malformed or of an unsupported version
    public static TreeSnapshot fromJson(String json) {
        try {
            return createMapper().readValue(json, TreeSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize processing tree: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Scanflow types.
    ///
    /// Registers:
    /// - `ScanflowJacksonModule` for snapshots, datasets and scans
    /// - `JavaTimeModule` for export timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ScanflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
