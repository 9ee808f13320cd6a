package io.scanflow.core.export;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.TreeSnapshot;
import java.util.Objects;

/// Everything an exporter writes for one result-producing node.
///
/// @param nodeId node id
/// @param label user label of the node, may be empty
/// @param pluginName human-readable plugin name
/// @param pluginClassName registry name of the plugin
/// @param data composite result with scan and point axis metadata, not null
/// @param tree provenance: the processing tree that produced the result, not null
/// @param context provenance: scan and experiment description, not null
public record NodeResultExport(
        int nodeId,
        String label,
        String pluginName,
        String pluginClassName,
        Dataset data,
        TreeSnapshot tree,
        ProcessingContext context) {

    public NodeResultExport {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(context, "context must not be null");
        label = label != null ? label : "";
    }
}
