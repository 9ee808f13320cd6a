package io.scanflow.core.execution;

import io.scanflow.core.ScanflowConfig;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.ConfigurationException;
import io.scanflow.core.exception.PluginExecutionException;
import io.scanflow.core.exception.PluginNotFoundException;
import io.scanflow.core.exception.ShapeMismatchException;
import io.scanflow.core.execution.buffer.SharedBufferPool;
import io.scanflow.core.execution.buffer.SlotLayout;
import io.scanflow.core.execution.pool.TaskFunction;
import io.scanflow.core.execution.pool.TaskOutcome;
import io.scanflow.core.execution.pool.WorkerController;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.result.ResultStore;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.ProcessingTree;
import io.scanflow.core.tree.TreeSnapshot;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs a processing tree over scan points on a pool of workers.
///
/// Tasks are flat scan indices. Before the workers start, the coordinator
/// 1. resolves the per-point result shapes, with a dry run of the first scan point on a private
///    copy of the tree if the tree has not run yet,
/// 2. declares these shapes in the {@link ResultStore},
/// 3. lays out one buffer slot holding the results of all result-producing nodes and allocates
///    a {@link SharedBufferPool} of `min(bufferBytes / slotBytes, maxSlots, taskCount)` slots.
///
/// Each worker rebuilds its own copy of the tree once and returns only a slot index per task.
/// On the listener thread the coordinator copies the slot into the result store and releases
/// the slot before any listener is notified. Subscribers therefore receive the task and the
/// (already released) slot index; the data itself is in the store.
///
/// A node whose result changed shape is rejected by the store, which marks it drifted; the
/// task is reported as failed with a {@link ShapeMismatchException}, while the results of the
/// other nodes of that task are still stored.
///
/// ### Contracts
/// - **Invariant**: no more than the pool's slot count of results are in flight at once
/// - **Postcondition**: every successfully processed task is written to the store exactly once
///
/// @implNote **Thread-safe** for control calls. The tree passed in is only read, on the
/// calling thread, during {@link #start()}.
///
/// @see WorkerController
/// @see TreeTaskFunction
public class RunCoordinator extends WorkerController<Integer, Integer> implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(RunCoordinator.class.getName());

    private final ProcessingTree tree;
    private final PluginRegistry registry;
    private final ProcessingContext context;
    private final ResultStore store;
    private final ScanflowConfig config;

    private volatile TreeSnapshot snapshot;
    private volatile SlotLayout layout;
    private volatile SharedBufferPool pool;

    /// Creates a coordinator.
    ///
    /// @param tree the configured tree, not null; workers run copies of it
    /// @param registry rebuilds plugins for the copies, not null
    /// @param context scan and experiment of the run, not null
    /// @param store receives the results, not null
    /// @param config worker count and buffer sizing, not null
    public RunCoordinator(
            ProcessingTree tree,
            PluginRegistry registry,
            ProcessingContext context,
            ResultStore store,
            ScanflowConfig config) {
        super("scanflow", config.getWorkerCount());
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = config;
    }

    /// Resolves shapes, sizes the buffer pool and starts the workers.
    ///
    /// Tasks should be submitted before starting; the pool is sized for the tasks known at
    /// this point, or for the whole scan if none were submitted yet.
    ///
    /// @throws ConfigurationException if the dry run fails, or if the buffer cannot hold one
    ///     slot per worker
    @Override
    public void start() {
        prepare();
        super.start();
    }

    private void prepare() {
        snapshot = tree.exportSnapshot();
        Map<Integer, int[]> shapes = resolveShapes();
        layout = SlotLayout.of(shapes);

        int taskCount =
                getSubmittedCount() > 0 ? getSubmittedCount() : context.scan().getPointCount();
        int slotBytes = layout.getSlotBytes();
        long fitting = config.getBufferSizeBytes() / slotBytes;
        int slotCount = (int) Math.min(Math.min(fitting, config.getMaxBufferSlots()), taskCount);
        if (slotCount < 1 || (slotCount < getWorkerCount() && slotCount < taskCount)) {
            double minimumMb =
                    Math.ceil((double) slotBytes * getWorkerCount() / (1024 * 1024) * 100) / 100;
            throw new ConfigurationException(
                    "Buffer of "
                            + config.getBufferSizeMb()
                            + " MiB holds only "
                            + fitting
                            + " result slots of "
                            + slotBytes
                            + " bytes for "
                            + getWorkerCount()
                            + " workers; increase the buffer size to at least "
                            + minimumMb
                            + " MiB");
        }
        pool = new SharedBufferPool(slotCount, slotBytes);
        logger.info(
                "Buffer pool of "
                        + slotCount
                        + " slots x "
                        + slotBytes
                        + " bytes for "
                        + shapes.size()
                        + " result nodes and "
                        + taskCount
                        + " tasks");
    }

    private Map<Integer, int[]> resolveShapes() {
        boolean known =
                tree.getResultProducingNodes().stream()
                        .allMatch(node -> node.getResultShape().isPresent());
        if (known) {
            store.declareShapes(tree);
            return tree.getResultShapes();
        }
        ProcessingTree probe = new ProcessingTree();
        try {
            probe.restore(snapshot, registry);
            probe.execute(0, context);
        } catch (PluginNotFoundException | PluginExecutionException e) {
            throw new ConfigurationException(
                    "Dry run to resolve result shapes failed: " + e.getMessage(), e);
        }
        logger.fine("Resolved result shapes with a dry run of scan point 0");
        store.declareShapes(probe);
        return probe.getResultShapes();
    }

    @Override
    protected TaskFunction<Integer, Integer> newTaskFunction() throws Exception {
        return new TreeTaskFunction(snapshot, registry, context, pool, layout);
    }

    @Override
    protected TaskOutcome<Integer, Integer> processOutcome(TaskOutcome<Integer, Integer> outcome) {
        if (!outcome.isSuccess()) {
            return outcome;
        }
        int slot = outcome.result();
        ShapeMismatchException rejected = null;
        try {
            for (SlotLayout.Entry entry : layout.getEntries()) {
                try {
                    storeEntry(entry, outcome.task(), slot);
                } catch (ShapeMismatchException e) {
                    if (rejected == null) {
                        rejected = e;
                    } else {
                        rejected.addSuppressed(e);
                    }
                }
            }
        } catch (RuntimeException e) {
            return TaskOutcome.failure(outcome.task(), e);
        } finally {
            pool.release(slot);
        }
        return rejected == null ? outcome : TaskOutcome.failure(outcome.task(), rejected);
    }

    private void storeEntry(SlotLayout.Entry entry, int task, int slot) {
        double status = pool.read(slot, entry.statusOffset(), 1)[0];
        if (status == SlotLayout.STATUS_DRIFTED) {
            throw store.rejectDrift(entry.nodeId(), task);
        }
        double[] values = pool.read(slot, entry.offset(), entry.size());
        store.write(entry.nodeId(), task, Dataset.of(entry.shape(), values));
    }

    /// Returns the buffer pool of the current run.
    ///
    /// @return pool, or null before {@link #start()}
    public SharedBufferPool getBufferPool() {
        return pool;
    }

    /// Returns the slot layout of the current run.
    ///
    /// @return layout, or null before {@link #start()}
    public SlotLayout getSlotLayout() {
        return layout;
    }

    public ResultStore getResultStore() {
        return store;
    }

    /// Stops the run if still active and closes the buffer pool.
    @Override
    public void close() {
        stop();
        SharedBufferPool current = pool;
        if (current != null) {
            current.close();
        }
    }
}
