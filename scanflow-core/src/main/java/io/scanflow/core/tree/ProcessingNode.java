package io.scanflow.core.tree;

import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.Plugin;
import io.scanflow.core.plugin.PluginType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A plugin together with its position in a {@link ProcessingTree}.
///
/// The node owns its plugin. Parent and children are referenced by id only; the tree owns the
/// nodes themselves. Result shape and axis metadata stay empty until the node has run
/// successfully once.
public final class ProcessingNode {

    private final int id;
    private Plugin plugin;
    private PluginType pluginType;
    private Integer parentId;
    private final List<Integer> childIds = new ArrayList<>();

    private int[] resultShape;
    private List<AxisMetadata> resultAxes = List.of();
    private String resultDataLabel = "";
    private String resultDataUnit = "";
    private long runtimeNanos = -1;
    private Dataset latestResult;

    ProcessingNode(int id, Plugin plugin, Integer parentId) {
        this.id = id;
        this.parentId = parentId;
        setPlugin(plugin);
    }

    public int getId() {
        return id;
    }

    public Plugin getPlugin() {
        return plugin;
    }

    /// Returns the plugin type captured when the plugin was attached.
    ///
    /// @return plugin type, never null
    public PluginType getPluginType() {
        return pluginType;
    }

    /// Returns the parent id.
    ///
    /// @return parent id, or null for the root
    public Integer getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /// Returns the child ids in insertion order.
    ///
    /// @return unmodifiable view, never null
    public List<Integer> getChildIds() {
        return Collections.unmodifiableList(childIds);
    }

    public boolean isLeaf() {
        return childIds.isEmpty();
    }

    /// Returns whether the plugin's `keep_results` parameter is set.
    ///
    /// @return true if intermediate results of this node are stored
    public boolean isKeepResults() {
        if (plugin instanceof BasePlugin base) {
            return base.isKeepResults();
        }
        Object value = plugin.getParameterValues().get(BasePlugin.KEEP_RESULTS);
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }

    /// Returns whether the results of this node go into the result store.
    ///
    /// Leaves and nodes with `keep_results` store their results, except for output plugins and
    /// plugins that produce no data.
    ///
    /// @return true if this node produces stored results
    public boolean isResultProducing() {
        return (isLeaf() || isKeepResults())
                && pluginType != PluginType.OUTPUT
                && !plugin.getOutputRank().isNone();
    }

    /// Returns the per-point result shape of the last successful execution.
    ///
    /// @return shape, or empty before the first run
    public Optional<int[]> getResultShape() {
        return Optional.ofNullable(resultShape).map(int[]::clone);
    }

    public List<AxisMetadata> getResultAxes() {
        return resultAxes;
    }

    public String getResultDataLabel() {
        return resultDataLabel;
    }

    public String getResultDataUnit() {
        return resultDataUnit;
    }

    /// Returns the runtime of the last execution.
    ///
    /// @return nanoseconds, or -1 if the node never ran
    public long getRuntimeNanos() {
        return runtimeNanos;
    }

    /// Returns the output of the last execution of a result-producing node.
    ///
    /// @return latest result, or empty if the node never ran or does not produce results
    public Optional<Dataset> getLatestResult() {
        return Optional.ofNullable(latestResult);
    }

    void setPlugin(Plugin plugin) {
        this.plugin = Objects.requireNonNull(plugin, "plugin must not be null");
        this.pluginType = Objects.requireNonNull(plugin.getPluginType(), "plugin type is null");
        clearResults();
    }

    void setParentId(Integer parentId) {
        this.parentId = parentId;
    }

    List<Integer> mutableChildIds() {
        return childIds;
    }

    void recordExecution(Dataset output, long nanos) {
        runtimeNanos = nanos;
        if (output == null) {
            latestResult = null;
            return;
        }
        resultShape = output.getShape();
        resultAxes = List.copyOf(output.getAxes());
        resultDataLabel = output.getDataLabel();
        resultDataUnit = output.getDataUnit();
        if (isResultProducing()) {
            // children may modify their input in place
            latestResult = isLeaf() ? output : output.copy();
        } else {
            latestResult = null;
        }
    }

    void clearResults() {
        resultShape = null;
        resultAxes = List.of();
        resultDataLabel = "";
        resultDataUnit = "";
        runtimeNanos = -1;
        latestResult = null;
    }

    @Override
    public String toString() {
        return "ProcessingNode{id="
                + id
                + ", plugin="
                + plugin.getName()
                + ", parent="
                + parentId
                + ", children="
                + childIds
                + "}";
    }
}
