package io.scanflow.core.plugin;

/// Role of a plugin within a processing tree.
///
/// Resolved once when the plugin is added to a tree.
public enum PluginType {
    /// Loads the raw data for a scan point. Normally the root of a tree.
    INPUT,
    /// Transforms the output of its parent.
    PROCESSING,
    /// Writes data out as a side effect. Output plugins never produce stored results.
    OUTPUT
}
