package io.scanflow.core.plugin;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.scan.ProcessingContext;
import java.util.Map;
import java.util.Optional;

/// A single, opaque processing step.
///
/// Plugins are the units a {@link io.scanflow.core.tree.ProcessingTree} is built from. A tree
/// calls {@link #preExecute(ProcessingContext)} once before a run and
/// {@link #execute(Dataset, Map)} once per scan point.
///
/// ### Contracts
/// - **Precondition**: `preExecute` has been called before the first `execute`
/// - **Postcondition**: `execute` returns data whose rank matches {@link #getOutputRank()},
///   unless the output rank is {@link Rank#ANY}
/// - **Invariant**: plugin state is owned by exactly one tree; workers get their own copies
///
/// @implNote Implementations need not be thread-safe. A plugin instance is only ever called
/// from the thread that owns its tree.
///
/// @see BasePlugin
/// @see PluginRegistry
public interface Plugin {

    /// Returns a human-readable plugin name.
    ///
    /// @return plugin name, never null
    String getName();

    /// Returns the role of this plugin.
    ///
    /// @return plugin type, never null
    PluginType getPluginType();

    /// Returns the rank of data this plugin accepts.
    ///
    /// @return input rank, never null
    Rank getInputRank();

    /// Returns the rank of data this plugin produces.
    ///
    /// @return output rank, never null
    Rank getOutputRank();

    /// Prepares the plugin for a run.
    ///
    /// @param context scan and experiment of the run, not null
    /// @throws Exception if the plugin cannot be prepared
    void preExecute(ProcessingContext context) throws Exception;

    /// Processes the data of one scan point.
    ///
    /// @param input output of the parent node, or a scalar holding the task index for the root
    /// @param options options forwarded from the parent, not null
    /// @return output data and options for the children, never null
    /// @throws Exception if processing fails
    PluginOutput execute(Dataset input, Map<String, Object> options) throws Exception;

    /// Returns diagnostic details of the most recent invocation, if the plugin keeps any.
    ///
    /// @return details, or empty
    default Optional<DetailedResults> getDetailedResults() {
        return Optional.empty();
    }

    /// Returns the current parameter values, keyed by parameter name.
    ///
    /// @return parameter values in declaration order, never null
    Map<String, Object> getParameterValues();

    /// Sets one parameter.
    ///
    /// @param name parameter name, not null
    /// @param value new value
    /// @throws IllegalArgumentException if the plugin has no such parameter
    void setParameterValue(String name, Object value);

    /// Returns the name under which this plugin is registered.
    ///
    /// Used to rebuild the plugin through a {@link PluginRegistry}.
    ///
    /// @return fully qualified class name by default, never null
    default String getPluginClassName() {
        return getClass().getName();
    }
}
