package io.scanflow.core.execution;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.PluginNotFoundException;
import io.scanflow.core.exception.ShapeMismatchException;
import io.scanflow.core.execution.buffer.SharedBufferPool;
import io.scanflow.core.execution.buffer.SlotLayout;
import io.scanflow.core.execution.pool.TaskFunction;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.ProcessingTree;
import io.scanflow.core.tree.TreeSnapshot;
import java.util.Arrays;
import java.util.logging.Logger;

/// Worker-side task function of a {@link RunCoordinator}.
///
/// Owns a private copy of the processing tree, rebuilt from a snapshot when the worker starts.
/// For each task it runs the tree, takes a buffer slot, copies the result of every
/// result-producing node into the slot and returns the slot index. A result whose shape differs
/// from the layout is not copied; its status value in the slot marks it as drifted, so that the
/// coordinator can reject it in the result store while keeping the other nodes' results.
final class TreeTaskFunction implements TaskFunction<Integer, Integer> {

    private static final Logger logger = Logger.getLogger(TreeTaskFunction.class.getName());

    private static final double[] WRITTEN = {SlotLayout.STATUS_WRITTEN};
    private static final double[] DRIFTED = {SlotLayout.STATUS_DRIFTED};

    private final ProcessingTree tree;
    private final ProcessingContext context;
    private final SharedBufferPool pool;
    private final SlotLayout layout;

    TreeTaskFunction(
            TreeSnapshot snapshot,
            PluginRegistry registry,
            ProcessingContext context,
            SharedBufferPool pool,
            SlotLayout layout)
            throws PluginNotFoundException {
        this.tree = new ProcessingTree();
        this.tree.restore(snapshot, registry);
        this.context = context;
        this.pool = pool;
        this.layout = layout;
    }

    @Override
    public Integer apply(Integer task) throws Exception {
        tree.execute(task, context);
        int slot = pool.acquire();
        try {
            for (SlotLayout.Entry entry : layout.getEntries()) {
                Dataset result =
                        tree.getNode(entry.nodeId())
                                .getLatestResult()
                                .orElseThrow(
                                        () ->
                                                new ShapeMismatchException(
                                                        entry.nodeId(),
                                                        "Node #"
                                                                + entry.nodeId()
                                                                + " produced no result for task "
                                                                + task));
                if (entry.matches(result.getShape())) {
                    pool.write(slot, entry.offset(), result.getData());
                    pool.write(slot, entry.statusOffset(), WRITTEN);
                } else {
                    logger.fine(
                            "Node #"
                                    + entry.nodeId()
                                    + " produced shape "
                                    + Arrays.toString(result.getShape())
                                    + " for task "
                                    + task);
                    pool.write(slot, entry.statusOffset(), DRIFTED);
                }
            }
        } catch (RuntimeException e) {
            pool.release(slot);
            throw e;
        }
        return slot;
    }
}
