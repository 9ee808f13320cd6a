package io.scanflow.core.result;

/// Descriptive data of a result-producing node, captured when the store is prepared.
///
/// @param nodeId node id
/// @param label user label of the node's plugin, may be empty
/// @param pluginName human-readable plugin name
/// @param pluginClassName registry name of the plugin
public record ResultNodeInfo(int nodeId, String label, String pluginName, String pluginClassName) {}
