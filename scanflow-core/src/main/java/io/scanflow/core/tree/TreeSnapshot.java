package io.scanflow.core.tree;

import java.util.List;
import java.util.Objects;

/// Serializable form of a whole {@link ProcessingTree}.
///
/// Records are ordered so that every parent precedes its children and siblings keep their
/// order.
///
/// @param formatVersion version of the snapshot layout
/// @param nodes node records, not null
public record TreeSnapshot(int formatVersion, List<NodeRecord> nodes) {

    /// Version written by this library.
    public static final int CURRENT_FORMAT_VERSION = 1;

    public TreeSnapshot {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
    }

    public static TreeSnapshot of(List<NodeRecord> nodes) {
        return new TreeSnapshot(CURRENT_FORMAT_VERSION, nodes);
    }
}
