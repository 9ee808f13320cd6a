package io.scanflow.core.result;

import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.ConfigurationException;
import io.scanflow.core.exception.ShapeMismatchException;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.Plugin;
import io.scanflow.core.scan.Scan;
import io.scanflow.core.tree.ProcessingNode;
import io.scanflow.core.tree.ProcessingTree;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Per-node store of results, addressed by flat scan index.
///
/// Every result-producing node gets one dense composite of shape
/// `scan shape + per-point shape`. The per-point shape is fixed by the first
/// {@link #declareShape(int, int[], List, String, String)} call; composites are allocated once
/// and filled with NaN, the marker for "no result".
///
/// ### Contracts
/// - **Invariant**: once declared, a node's per-point shape never changes until {@link #reset()}
/// - **Invariant**: a write with a different shape is rejected and leaves the store unchanged
/// - **Postcondition**: after a rejected write the node is drifted and refuses every further
///   write until {@link #reset()}
///
/// @implNote **Thread-safe**. All methods synchronize on the store. In a parallel run only the
/// coordinator's listener thread writes; readers may run on any thread.
///
/// @see io.scanflow.core.execution.RunCoordinator
public class ResultStore {

    private static final Logger logger = Logger.getLogger(ResultStore.class.getName());

    /// Label of the single axis replacing all scan axes in flattened views.
    public static final String TIMELINE_LABEL = "Chronological scan points";

    private final Scan scan;
    private final Map<Integer, ResultNodeInfo> nodeInfo = new LinkedHashMap<>();
    private final Map<Integer, NodeComposite> composites = new LinkedHashMap<>();
    private final Set<Integer> drifted = new HashSet<>();

    /// Creates an empty store for the given scan.
    ///
    /// @param scan scan geometry, not null
    public ResultStore(Scan scan) {
        this.scan = Objects.requireNonNull(scan, "scan must not be null");
    }

    public Scan getScan() {
        return scan;
    }

    /// Clears the store and records the result-producing nodes of a tree.
    ///
    /// @param tree tree whose results will be stored, not null
    public synchronized void prepare(ProcessingTree tree) {
        nodeInfo.clear();
        composites.clear();
        drifted.clear();
        for (ProcessingNode node : tree.getResultProducingNodes()) {
            Plugin plugin = node.getPlugin();
            String label = plugin instanceof BasePlugin base ? base.getLabel() : "";
            nodeInfo.put(
                    node.getId(),
                    new ResultNodeInfo(
                            node.getId(),
                            label,
                            plugin.getName(),
                            plugin.getPluginClassName()));
        }
        logger.fine("Prepared result store for nodes " + nodeInfo.keySet());
    }

    /// Fixes the per-point shape of a node and allocates its composite.
    ///
    /// The first declaration wins. Declaring the same shape again is a no-op.
    ///
    /// @param nodeId node id
    /// @param shape per-point shape, not null
    /// @param axes per-point axis metadata, or null for index axes
    /// @param dataLabel label of the values, may be null
    /// @param dataUnit unit of the values, may be null
    /// @throws ShapeMismatchException if a different shape was declared before
    public synchronized void declareShape(
            int nodeId, int[] shape, List<AxisMetadata> axes, String dataLabel, String dataUnit) {
        Objects.requireNonNull(shape, "shape must not be null");
        NodeComposite existing = composites.get(nodeId);
        if (existing != null) {
            if (!existing.hasPointShape(shape)) {
                throw new ShapeMismatchException(nodeId, existing.getPointShape(), shape);
            }
            return;
        }
        List<AxisMetadata> pointAxes = axes;
        if (pointAxes == null || pointAxes.size() != shape.length) {
            pointAxes = new ArrayList<>(shape.length);
            for (int length : shape) {
                pointAxes.add(AxisMetadata.indexAxis(length));
            }
        }
        composites.put(
                nodeId,
                new NodeComposite(
                        scan.getPointCount(),
                        shape,
                        pointAxes,
                        dataLabel != null ? dataLabel : "",
                        dataUnit != null ? dataUnit : ""));
        logger.fine("Declared shape " + Arrays.toString(shape) + " for node #" + nodeId);
    }

    /// Declares a node's shape and metadata from a sample result.
    ///
    /// @param nodeId node id
    /// @param sample a result of the node, not null
    /// @throws ShapeMismatchException if a different shape was declared before
    public void declareShape(int nodeId, Dataset sample) {
        declareShape(
                nodeId,
                sample.getShape(),
                sample.getAxes(),
                sample.getDataLabel(),
                sample.getDataUnit());
    }

    /// Declares the shapes of all result-producing nodes of a tree that has run once.
    ///
    /// @param tree tree with known result shapes, not null
    /// @throws ConfigurationException if a node's shape is still unknown
    /// @throws ShapeMismatchException if a node's shape differs from an earlier declaration
    public void declareShapes(ProcessingTree tree) {
        Map<Integer, int[]> shapes = tree.getResultShapes();
        for (Map.Entry<Integer, int[]> entry : shapes.entrySet()) {
            ProcessingNode node = tree.getNode(entry.getKey());
            declareShape(
                    entry.getKey(),
                    entry.getValue(),
                    node.getResultAxes(),
                    node.getResultDataLabel(),
                    node.getResultDataUnit());
        }
    }

    /// Stores the result of one scan point.
    ///
    /// @param nodeId node id
    /// @param scanIndex flat scan index
    /// @param value result, not null
    /// @throws ConfigurationException if no shape was declared for the node
    /// @throws IndexOutOfBoundsException if the scan index lies outside the scan
    /// @throws ShapeMismatchException if the value does not have the declared shape, or if
    ///     the node is drifted
    public synchronized void write(int nodeId, int scanIndex, Dataset value) {
        Objects.requireNonNull(value, "value must not be null");
        NodeComposite composite = getCompositeOrThrow(nodeId);
        checkWritable(nodeId);
        checkScanIndex(scanIndex);
        if (!value.hasShape(composite.getPointShape())) {
            throw markDrifted(nodeId, scanIndex, composite.getPointShape(), value.getShape());
        }
        composite.write(scanIndex, value.getData());
    }

    /// Rejects the result of a scan point whose shape is known to differ from the declared one.
    ///
    /// Used when only the fact of the mismatch reaches the store, not the result itself. The
    /// node is drifted afterwards, exactly as after a rejected {@link #write}.
    ///
    /// @param nodeId node id
    /// @param scanIndex flat scan index
    /// @return the exception describing the rejection, for the caller to throw or report
    /// @throws ConfigurationException if no shape was declared for the node
    /// @throws IndexOutOfBoundsException if the scan index lies outside the scan
    /// @throws ShapeMismatchException if the node was drifted before
    public synchronized ShapeMismatchException rejectDrift(int nodeId, int scanIndex) {
        NodeComposite composite = getCompositeOrThrow(nodeId);
        checkWritable(nodeId);
        checkScanIndex(scanIndex);
        return markDrifted(nodeId, scanIndex, composite.getPointShape(), null);
    }

    private void checkWritable(int nodeId) {
        if (drifted.contains(nodeId)) {
            throw new ShapeMismatchException(
                    nodeId,
                    "Node #"
                            + nodeId
                            + " changed its result shape earlier in this run; writes are"
                            + " disabled until the store is reset");
        }
    }

    private ShapeMismatchException markDrifted(
            int nodeId, int scanIndex, int[] declared, int[] actual) {
        drifted.add(nodeId);
        logger.warning(
                "Result shape of node #"
                        + nodeId
                        + " drifted at scan index "
                        + scanIndex
                        + (actual != null ? ": " + Arrays.toString(actual) : ""));
        if (actual != null) {
            return new ShapeMismatchException(nodeId, declared, actual);
        }
        return new ShapeMismatchException(
                nodeId,
                "Node #"
                        + nodeId
                        + " produced a result of another shape than "
                        + Arrays.toString(declared)
                        + " at scan index "
                        + scanIndex);
    }

    /// Returns the result stored for one scan point.
    ///
    /// @param nodeId node id
    /// @param scanIndex flat scan index
    /// @return copy of the stored values with point axis metadata; NaN if never written
    public synchronized Dataset read(int nodeId, int scanIndex) {
        NodeComposite composite = getCompositeOrThrow(nodeId);
        checkScanIndex(scanIndex);
        Dataset result =
                Dataset.of(composite.getPointShape(), composite.read(scanIndex, scanIndex + 1));
        result.withAxes(composite.getPointAxes());
        return result.withDataLabel(composite.getDataLabel(), composite.getDataUnit());
    }

    /// Returns the results of a contiguous range of flat scan indices.
    ///
    /// @param nodeId node id
    /// @param from first flat index, inclusive
    /// @param to last flat index, exclusive
    /// @return dataset with a leading timeline axis followed by the point axes
    /// @throws IndexOutOfBoundsException if the range does not lie inside the scan
    public synchronized Dataset readRange(int nodeId, int from, int to) {
        NodeComposite composite = getCompositeOrThrow(nodeId);
        if (from < 0 || to > scan.getPointCount() || from > to) {
            throw new IndexOutOfBoundsException(
                    "Range [" + from + ", " + to + ") outside scan of " + scan.getPointCount());
        }
        int[] pointShape = composite.getPointShape();
        int[] shape = new int[pointShape.length + 1];
        shape[0] = to - from;
        System.arraycopy(pointShape, 0, shape, 1, pointShape.length);

        double[] timeline = new double[to - from];
        for (int i = 0; i < timeline.length; i++) {
            timeline[i] = from + i;
        }
        List<AxisMetadata> axes = new ArrayList<>();
        axes.add(new AxisMetadata(TIMELINE_LABEL, "", timeline));
        axes.addAll(composite.getPointAxes());

        Dataset result = Dataset.of(shape, composite.read(from, to));
        result.withAxes(axes);
        return result.withDataLabel(composite.getDataLabel(), composite.getDataUnit());
    }

    /// Returns all results of a node with the scan dimensions collapsed to one timeline axis.
    ///
    /// @param nodeId node id
    /// @return dataset of shape `[scan points] + point shape`
    public Dataset readFlattened(int nodeId) {
        return readRange(nodeId, 0, scan.getPointCount());
    }

    /// Returns all results of a node in scan geometry.
    ///
    /// @param nodeId node id
    /// @return dataset of shape `scan shape + point shape` with scan and point axes
    public synchronized Dataset getComposite(int nodeId) {
        NodeComposite composite = getCompositeOrThrow(nodeId);
        ResultMetadata metadata = buildMetadata(nodeId, composite, false);
        Dataset result = Dataset.of(metadata.shape(), composite.read(0, scan.getPointCount()));
        result.withAxes(metadata.axes());
        return result.withDataLabel(metadata.dataLabel(), metadata.dataUnit());
    }

    /// Returns shape and axis metadata of a node's composite.
    ///
    /// @param nodeId node id
    /// @param useTimeline true to collapse the scan axes into one timeline axis
    /// @return metadata, never null
    public synchronized ResultMetadata getResultMetadata(int nodeId, boolean useTimeline) {
        return buildMetadata(nodeId, getCompositeOrThrow(nodeId), useTimeline);
    }

    private ResultMetadata buildMetadata(
            int nodeId, NodeComposite composite, boolean useTimeline) {
        int[] pointShape = composite.getPointShape();
        List<AxisMetadata> axes = new ArrayList<>();
        int[] leading;
        if (useTimeline) {
            leading = new int[] {scan.getPointCount()};
            axes.add(
                    new AxisMetadata(
                            TIMELINE_LABEL,
                            "",
                            AxisMetadata.indexAxis(scan.getPointCount()).range()));
        } else {
            leading = scan.getShape();
            axes.addAll(scan.getAxisMetadata());
        }
        axes.addAll(composite.getPointAxes());
        int[] shape = new int[leading.length + pointShape.length];
        System.arraycopy(leading, 0, shape, 0, leading.length);
        System.arraycopy(pointShape, 0, shape, leading.length, pointShape.length);
        return new ResultMetadata(shape, axes, composite.getDataLabel(), composite.getDataUnit());
    }

    /// Returns the declared per-point shapes.
    ///
    /// @return shapes keyed by node id, in declaration order
    public synchronized Map<Integer, int[]> getShapes() {
        Map<Integer, int[]> shapes = new LinkedHashMap<>();
        composites.forEach((id, composite) -> shapes.put(id, composite.getPointShape()));
        return shapes;
    }

    public synchronized boolean isDeclared(int nodeId) {
        return composites.containsKey(nodeId);
    }

    public synchronized boolean isDrifted(int nodeId) {
        return drifted.contains(nodeId);
    }

    /// Returns how many scan points of a node hold a result.
    ///
    /// @param nodeId node id
    /// @return number of written positions, 0 for undeclared nodes
    public synchronized int getWrittenCount(int nodeId) {
        NodeComposite composite = composites.get(nodeId);
        return composite != null ? composite.getWrittenCount() : 0;
    }

    /// Returns the node ids with a declared composite.
    ///
    /// @return unmodifiable list in declaration order
    public synchronized List<Integer> getNodeIds() {
        return Collections.unmodifiableList(new ArrayList<>(composites.keySet()));
    }

    /// Returns descriptive data of a node recorded by {@link #prepare(ProcessingTree)}.
    ///
    /// @param nodeId node id
    /// @return node info, or empty if the node was not prepared
    public synchronized Optional<ResultNodeInfo> getNodeInfo(int nodeId) {
        return Optional.ofNullable(nodeInfo.get(nodeId));
    }

    /// Drops all data, declared shapes and drift flags.
    ///
    /// Node infos recorded by {@link #prepare(ProcessingTree)} are kept.
    public synchronized void reset() {
        composites.clear();
        drifted.clear();
        logger.fine("Result store reset");
    }

    private NodeComposite getCompositeOrThrow(int nodeId) {
        NodeComposite composite = composites.get(nodeId);
        if (composite == null) {
            throw new ConfigurationException("No result shape declared for node #" + nodeId);
        }
        return composite;
    }

    private void checkScanIndex(int scanIndex) {
        if (scanIndex < 0 || scanIndex >= scan.getPointCount()) {
            throw new IndexOutOfBoundsException(
                    "Scan index " + scanIndex + " outside scan of " + scan.getPointCount());
        }
    }
}
