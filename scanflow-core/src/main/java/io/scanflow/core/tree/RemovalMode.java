package io.scanflow.core.tree;

/// How {@link ProcessingTree#removeNode(int, RemovalMode)} treats the children of a removed
/// node.
public enum RemovalMode {
    /// Remove only the node. Its children take its place under its parent.
    NODE_ONLY,
    /// Remove the node together with all of its descendants.
    BRANCH
}
