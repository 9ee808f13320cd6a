package io.scanflow.core.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Serializable description of one tree node.
///
/// @param nodeId node id
/// @param parentId id of the parent node, null for the root
/// @param pluginClassName registry name of the node's plugin, not null
/// @param parameterValues plugin parameter values in declaration order, not null
public record NodeRecord(
        int nodeId, Integer parentId, String pluginClassName, Map<String, Object> parameterValues) {

    public NodeRecord {
        Objects.requireNonNull(pluginClassName, "pluginClassName must not be null");
        // LinkedHashMap keeps declaration order and tolerates null parameter values
        parameterValues =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(
                                Objects.requireNonNull(
                                        parameterValues, "parameterValues must not be null")));
    }
}
