package io.scanflow.core.app;

import io.scanflow.core.ScanflowConfig;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.exception.PluginExecutionException;
import io.scanflow.core.exception.ShapeMismatchException;
import io.scanflow.core.exception.WorkerPoolException;
import io.scanflow.core.execution.RunCoordinator;
import io.scanflow.core.execution.pool.WorkerControllerListener;
import io.scanflow.core.export.ResultExportService;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.result.ResultStore;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.ProcessingTree;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/// Processes a scan with a processing tree, either one point at a time or in parallel.
///
/// The app owns a {@link ResultStore} sized for the scan. {@link #runOnce(int)} executes the
/// tree on the calling thread and stores the collected results. {@link #runAll()} hands the
/// scan to a {@link RunCoordinator} and blocks until every point was processed or the run was
/// {@link #abort() aborted}. With autosave configured, results are exported after each
/// complete parallel run.
///
/// @implNote **Not thread-safe**, except for {@link #abort()} and {@link #getProgress()},
/// which may be called from any thread while a run is in progress.
public class ScanProcessingApp {

    private static final Logger logger = Logger.getLogger(ScanProcessingApp.class.getName());

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final ProcessingTree tree;
    private final ProcessingContext context;
    private final PluginRegistry registry;
    private final ScanflowConfig config;
    private final ResultExportService exportService;
    private final ResultStore store;
    private final List<WorkerControllerListener<Integer, Integer>> runListeners =
            new CopyOnWriteArrayList<>();

    private volatile RunCoordinator current;
    private volatile boolean aborted;
    private boolean storePrepared;

    /// Creates an app.
    ///
    /// @param tree processing tree, not null
    /// @param context scan and experiment, not null
    /// @param registry rebuilds plugins for worker copies, not null
    /// @param config worker, buffer and autosave settings, not null
    /// @param exportService used for autosave, not null
    public ScanProcessingApp(
            ProcessingTree tree,
            ProcessingContext context,
            PluginRegistry registry,
            ScanflowConfig config,
            ResultExportService exportService) {
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.exportService = Objects.requireNonNull(exportService, "exportService must not be null");
        this.store = new ResultStore(context.scan());
    }

    public ProcessingTree getTree() {
        return tree;
    }

    public ProcessingContext getContext() {
        return context;
    }

    public ResultStore getResultStore() {
        return store;
    }

    /// Registers a listener attached to every subsequent parallel run.
    ///
    /// @param listener receives progress and per-task notifications, not null
    public void addRunListener(WorkerControllerListener<Integer, Integer> listener) {
        runListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Processes a single scan point on the calling thread.
    ///
    /// The results are also written to the result store; the first stored result of a node
    /// fixes its shape. A result of another shape drifts its node, while the results of the
    /// other nodes are still stored.
    ///
    /// @param task flat scan index
    /// @return results of the result-producing nodes, keyed by node id
    /// @throws PluginExecutionException if a plugin fails
    /// @throws ShapeMismatchException if a result does not fit the shape stored before, or its
    ///     node drifted earlier
    public Map<Integer, Dataset> runOnce(int task) throws PluginExecutionException {
        Map<Integer, Dataset> results = tree.executeAndCollect(task, context);
        if (!storePrepared) {
            store.prepare(tree);
            storePrepared = true;
        }
        ShapeMismatchException rejected = null;
        for (Map.Entry<Integer, Dataset> result : results.entrySet()) {
            if (result.getValue() == null) {
                continue;
            }
            if (!store.isDeclared(result.getKey())) {
                store.declareShape(result.getKey(), result.getValue());
            }
            try {
                store.write(result.getKey(), task, result.getValue());
            } catch (ShapeMismatchException e) {
                if (rejected == null) {
                    rejected = e;
                } else {
                    rejected.addSuppressed(e);
                }
            }
        }
        if (rejected != null) {
            throw rejected;
        }
        return results;
    }

    /// Processes every point of the scan in parallel.
    ///
    /// @return summary of the run, never null
    /// @throws InterruptedException if interrupted while waiting for the run
    /// @throws WorkerPoolException if a worker died; the run was stopped
    public RunSummary runAll() throws InterruptedException {
        List<Integer> tasks = new ArrayList<>(context.scan().getPointCount());
        for (int i = 0; i < context.scan().getPointCount(); i++) {
            tasks.add(i);
        }
        return runAll(tasks);
    }

    /// Processes the given scan points in parallel.
    ///
    /// The result store is cleared first.
    ///
    /// @param tasks flat scan indices, not null
    /// @return summary of the run, never null
    /// @throws InterruptedException if interrupted while waiting for the run
    /// @throws WorkerPoolException if a worker died; the run was stopped
    /// @throws io.scanflow.core.exception.ConfigurationException if shapes cannot be resolved
    ///     or the buffer is too small
    public RunSummary runAll(Collection<Integer> tasks) throws InterruptedException {
        store.prepare(tree);
        storePrepared = true;
        aborted = false;

        AtomicInteger succeeded = new AtomicInteger();
        Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
        AtomicReference<WorkerPoolException> workerFailure = new AtomicReference<>();

        long start = System.nanoTime();
        RunCoordinator coordinator = new RunCoordinator(tree, registry, context, store, config);
        coordinator.onResult((task, slot) -> succeeded.incrementAndGet());
        coordinator.onFailure(failures::put);
        coordinator.onWorkerFailure(workerFailure::set);
        runListeners.forEach(coordinator::addListener);

        current = coordinator;
        try {
            coordinator.submit(tasks);
            coordinator.start();
            coordinator.finalizeTasks();
            awaitRun(coordinator);
        } finally {
            current = null;
            coordinator.close();
        }

        if (workerFailure.get() != null) {
            throw workerFailure.get();
        }
        RunSummary summary =
                new RunSummary(
                        tasks.size(),
                        succeeded.get(),
                        failures,
                        aborted,
                        Duration.ofNanos(System.nanoTime() - start));
        logger.info(
                "Run finished: "
                        + summary.succeeded()
                        + " of "
                        + summary.submitted()
                        + " tasks succeeded, "
                        + summary.failed()
                        + " failed"
                        + (summary.aborted() ? " (aborted)" : "")
                        + " in "
                        + summary.elapsed().toMillis()
                        + " ms");
        if (config.isAutosaveEnabled() && !summary.aborted()) {
            autosave();
        }
        return summary;
    }

    private void awaitRun(RunCoordinator coordinator) throws InterruptedException {
        long abortDeadline = Long.MAX_VALUE;
        while (!coordinator.awaitTermination(POLL_INTERVAL)) {
            if (aborted && abortDeadline == Long.MAX_VALUE) {
                abortDeadline = System.nanoTime() + config.getShutdownTimeout().toNanos();
            }
            if (System.nanoTime() > abortDeadline) {
                logger.warning(
                        "Aborted run did not stop within " + config.getShutdownTimeout());
                return;
            }
        }
    }

    /// Exports the current results to the configured autosave directory.
    ///
    /// @return written files, never null
    public List<Path> autosave() {
        return exportService.exportAll(
                config.getAutosaveDirectory(),
                config.getAutosaveFormats(),
                store,
                tree.exportSnapshot(),
                context);
    }

    /// Stops the running parallel run. In-flight tasks finish; pending tasks are discarded.
    public void abort() {
        aborted = true;
        RunCoordinator coordinator = current;
        if (coordinator != null) {
            logger.info("Aborting run");
            coordinator.stop();
        }
    }

    /// Returns the progress of the running parallel run.
    ///
    /// @return fraction of tasks completed, or -1 if no run is active
    public double getProgress() {
        RunCoordinator coordinator = current;
        return coordinator != null ? coordinator.getProgress() : -1;
    }
}
