package io.scanflow.core.plugin;

import io.scanflow.core.data.Dataset;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Result of one plugin invocation: the output data and the options passed on to children.
///
/// @param data output dataset, may be null for plugins of output rank {@link Rank#NONE}
/// @param options key-value options forwarded to child plugins, not null
public record PluginOutput(Dataset data, Map<String, Object> options) {

    public PluginOutput {
        Objects.requireNonNull(options, "options must not be null");
    }

    /// Creates an independent copy for fan-out to sibling nodes.
    ///
    /// The dataset is deep-copied and the options map is shallow-copied.
    ///
    /// @return new output, never null
    public PluginOutput copy() {
        return new PluginOutput(data != null ? data.copy() : null, new HashMap<>(options));
    }
}
