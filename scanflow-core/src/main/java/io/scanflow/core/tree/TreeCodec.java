package io.scanflow.core.tree;

/// Converts tree snapshots to and from a text representation.
///
/// @see TreeSnapshot
public interface TreeCodec {

    /// Serializes a snapshot.
    ///
    /// @param snapshot snapshot to serialize, not null
    /// @return text form, never null
    /// @throws IllegalArgumentException if the snapshot cannot be serialized
    String dump(TreeSnapshot snapshot);

    /// Parses a snapshot.
    ///
    /// @param text text form, not null
    /// @return parsed snapshot, never null
    /// @throws IllegalArgumentException if the text is malformed or of an unsupported version
    TreeSnapshot load(String text);
}
