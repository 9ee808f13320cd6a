package io.scanflow.core.execution.pool;

import io.scanflow.core.exception.WorkerPoolException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Distributes tasks over a fixed pool of worker threads and reports their outcomes.
///
/// Workers run on a fixed thread pool of {@link #getWorkerCount()} threads, the listener on a
/// single-thread executor; both pools are shut down when the listener finishes.
/// Tasks are kept in a pending list until the listener thread dispatches them, in
/// submission order, into a bounded input channel. Each worker takes tasks from that channel,
/// applies its own {@link TaskFunction} and pushes the outcome to an output channel. The
/// listener thread drains the output channel and notifies the registered
/// {@link WorkerControllerListener}s. No external event loop is involved.
///
/// ### Lifecycle
/// - {@link #submit(Collection)} may be called before or after {@link #start()}
/// - {@link #finalizeTasks()} lets the workers exit once all pending tasks are done
/// - {@link #suspend()} holds back outcome delivery; workers keep computing
/// - {@link #restart()} resumes delivery; nothing submitted in between is lost
/// - {@link #stop()} discards pending tasks and lets in-flight tasks finish
///
/// ### Failure policy
/// A task whose function throws is reported through {@link WorkerControllerListener#onFailure}
/// and the pool carries on. A worker that dies outside of task processing (an `Error`
/// escaping its loop, or a task function that cannot be created) is not replaced: the
/// controller reports {@link WorkerPoolException}, discards pending work and stops.
///
/// @implNote **Thread-safe**. Control methods may be called from any thread. A controller runs
/// once; after {@link ControllerState#STOPPED} it cannot be started again.
///
/// @param <T> task type
/// @param <R> result type
public class WorkerController<T, R> {

    private static final Logger logger = Logger.getLogger(WorkerController.class.getName());

    private static final long POLL_INTERVAL_MS = 10;

    private final String name;
    private final int workerCount;
    private final Supplier<? extends TaskFunction<T, R>> functionFactory;

    private final BlockingQueue<Envelope<T>> inputChannel;
    private final BlockingQueue<Message<T, R>> outputChannel = new LinkedBlockingQueue<>();
    private final List<WorkerControllerListener<T, R>> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<T> pending = new ArrayDeque<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    // guarded by lock
    private int submitted;
    private int completed;
    private int sentinelsToSend;
    private boolean started;
    private boolean suspended;
    private boolean finalizeRequested;
    private boolean stopRequested;
    private boolean sentinelsQueued;
    private boolean finished;

    private volatile ExecutorService workerPool;
    private volatile ExecutorService listenerExecutor;

    // listener thread only
    private int liveWorkers;

    /// Creates a controller whose workers obtain their task function from a factory.
    ///
    /// @param name thread name prefix, not null
    /// @param workerCount number of workers, at least 1
    /// @param functionFactory called once per worker, on the worker's thread, not null
    public WorkerController(
            String name, int workerCount, Supplier<? extends TaskFunction<T, R>> functionFactory) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        this.workerCount = workerCount;
        this.functionFactory = functionFactory;
        this.inputChannel = new ArrayBlockingQueue<>(workerCount);
    }

    /// Creates a controller for subclasses that override {@link #newTaskFunction()}.
    ///
    /// @param name thread name prefix, not null
    /// @param workerCount number of workers, at least 1
    protected WorkerController(String name, int workerCount) {
        this(name, workerCount, null);
    }

    /// Creates the task function of one worker.
    ///
    /// Called once per worker, on the worker's own thread.
    ///
    /// @return a function owned exclusively by the calling worker, never null
    /// @throws Exception if the function cannot be created; the worker then counts as dead
    protected TaskFunction<T, R> newTaskFunction() throws Exception {
        if (functionFactory == null) {
            throw new IllegalStateException("No task function factory configured");
        }
        return functionFactory.get();
    }

    /// Inspects each outcome on the listener thread before listeners are notified.
    ///
    /// Subclasses may consume the result and turn a success into a failure.
    ///
    /// @param outcome outcome as produced by a worker, not null
    /// @return outcome passed on to the listeners, never null
    protected TaskOutcome<T, R> processOutcome(TaskOutcome<T, R> outcome) {
        return outcome;
    }

    // -- Subscriptions ---------------------------------------------------------------------

    public void addListener(WorkerControllerListener<T, R> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(WorkerControllerListener<T, R> listener) {
        listeners.remove(listener);
    }

    public void onProgress(DoubleConsumer callback) {
        addListener(
                new WorkerControllerListener<>() {
                    @Override
                    public void onProgress(double progress) {
                        callback.accept(progress);
                    }
                });
    }

    public void onResult(BiConsumer<T, R> callback) {
        addListener(
                new WorkerControllerListener<>() {
                    @Override
                    public void onResult(T task, R result) {
                        callback.accept(task, result);
                    }
                });
    }

    public void onFailure(BiConsumer<T, Throwable> callback) {
        addListener(
                new WorkerControllerListener<>() {
                    @Override
                    public void onFailure(T task, Throwable error) {
                        callback.accept(task, error);
                    }
                });
    }

    public void onWorkerFailure(Consumer<WorkerPoolException> callback) {
        addListener(
                new WorkerControllerListener<>() {
                    @Override
                    public void onWorkerFailure(WorkerPoolException error) {
                        callback.accept(error);
                    }
                });
    }

    public void onFinished(Runnable callback) {
        addListener(
                new WorkerControllerListener<>() {
                    @Override
                    public void onFinished() {
                        callback.run();
                    }
                });
    }

    // -- Control ---------------------------------------------------------------------------

    /// Appends tasks to the pending list.
    ///
    /// @param tasks tasks to process, not null, no null elements
    /// @throws IllegalStateException after {@link #finalizeTasks()} or {@link #stop()}
    public void submit(Collection<? extends T> tasks) {
        lock.lock();
        try {
            if (finalizeRequested || stopRequested || finished) {
                throw new IllegalStateException(
                        "Controller '" + name + "' no longer accepts tasks");
            }
            for (T task : tasks) {
                pending.addLast(Objects.requireNonNull(task, "task must not be null"));
            }
            submitted += tasks.size();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void submit(T task) {
        submit(List.of(task));
    }

    /// Starts the workers and the listener thread.
    ///
    /// @throws IllegalStateException if the controller was already started
    public void start() {
        lock.lock();
        try {
            if (started || finished) {
                throw new IllegalStateException("Controller '" + name + "' was already started");
            }
            started = true;
        } finally {
            lock.unlock();
        }
        liveWorkers = workerCount;
        workerPool = Executors.newFixedThreadPool(workerCount, threadFactory("worker"));
        listenerExecutor = Executors.newSingleThreadExecutor(threadFactory("listener"));
        for (int i = 0; i < workerCount; i++) {
            workerPool.execute(this::workerLoop);
        }
        listenerExecutor.execute(this::listenerLoop);
        logger.info("Started '" + name + "' with " + workerCount + " workers");
    }

    /// Lets every worker exit once all pending tasks are processed.
    public void finalizeTasks() {
        lock.lock();
        try {
            finalizeRequested = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /// Holds back outcome delivery. Workers keep processing.
    public void suspend() {
        lock.lock();
        try {
            if (!stopRequested && !finished) {
                suspended = true;
            }
        } finally {
            lock.unlock();
        }
    }

    /// Resumes outcome delivery after {@link #suspend()}.
    public void restart() {
        lock.lock();
        try {
            suspended = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /// Stops dispatching. Pending tasks are discarded, in-flight tasks finish and are
    /// delivered, then the workers exit.
    public void stop() {
        boolean finishNow;
        lock.lock();
        try {
            if (finished) {
                return;
            }
            stopRequested = true;
            suspended = false;
            int discarded = pending.size();
            pending.clear();
            List<Envelope<T>> queued = new ArrayList<>();
            inputChannel.drainTo(queued);
            for (Envelope<T> envelope : queued) {
                if (envelope.stop()) {
                    sentinelsToSend++;
                } else {
                    discarded++;
                }
            }
            if (discarded > 0) {
                logger.info("Controller '" + name + "' discarded " + discarded + " pending tasks");
            }
            finishNow = !started;
            if (finishNow) {
                finished = true;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (finishNow) {
            notifyFinished();
        }
    }

    /// Waits until the controller reached {@link ControllerState#STOPPED} and every
    /// `onFinished` callback returned.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if stopped in time
    /// @throws InterruptedException if interrupted while waiting
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // -- State -----------------------------------------------------------------------------

    public ControllerState getState() {
        lock.lock();
        try {
            if (finished) {
                return ControllerState.STOPPED;
            }
            if (!started) {
                return ControllerState.IDLE;
            }
            if (suspended) {
                return ControllerState.SUSPENDED;
            }
            if (finalizeRequested || stopRequested) {
                return ControllerState.DRAINING;
            }
            return ControllerState.RUNNING;
        } finally {
            lock.unlock();
        }
    }

    /// Returns the fraction of submitted tasks whose outcome has been delivered.
    ///
    /// @return value in `[0, 1]`, or -1 if nothing was submitted
    public double getProgress() {
        lock.lock();
        try {
            return submitted == 0 ? -1 : (double) completed / submitted;
        } finally {
            lock.unlock();
        }
    }

    public int getSubmittedCount() {
        lock.lock();
        try {
            return submitted;
        } finally {
            lock.unlock();
        }
    }

    public int getCompletedCount() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public String getName() {
        return name;
    }

    private ThreadFactory threadFactory(String role) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String threadName = name + "-" + role + "-" + counter.getAndIncrement();
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        };
    }

    // -- Worker side -----------------------------------------------------------------------

    private void workerLoop() {
        String workerName = Thread.currentThread().getName();
        try {
            TaskFunction<T, R> function = newTaskFunction();
            while (true) {
                Envelope<T> envelope = inputChannel.take();
                if (envelope.stop()) {
                    break;
                }
                TaskOutcome<T, R> outcome;
                try {
                    outcome = TaskOutcome.success(envelope.task(), function.apply(envelope.task()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outputChannel.add(Message.outcome(TaskOutcome.failure(envelope.task(), e)));
                    outputChannel.add(Message.died(workerName, e));
                    return;
                } catch (Exception e) {
                    outcome = TaskOutcome.failure(envelope.task(), e);
                }
                outputChannel.add(Message.outcome(outcome));
            }
            outputChannel.add(Message.exited(workerName));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outputChannel.add(Message.died(workerName, e));
        } catch (Exception | Error e) {
            outputChannel.add(Message.died(workerName, e));
        }
    }

    // -- Listener side ---------------------------------------------------------------------

    private void listenerLoop() {
        try {
            while (liveWorkers > 0 || !outputChannel.isEmpty()) {
                dispatch();
                if (isSuspended()) {
                    awaitChange();
                    continue;
                }
                Message<T, R> message = outputChannel.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    handle(message);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Listener of '" + name + "' interrupted; delivery stops");
        }
        lock.lock();
        try {
            finished = true;
        } finally {
            lock.unlock();
        }
        logger.info("Controller '" + name + "' finished");
        workerPool.shutdown();
        listenerExecutor.shutdown();
        notifyFinished();
    }

    /// Moves pending tasks into the input channel and queues stop sentinels once the pending
    /// list is exhausted after finalize or stop.
    private void dispatch() {
        lock.lock();
        try {
            if (!stopRequested) {
                while (!pending.isEmpty() && inputChannel.offer(Envelope.of(pending.peekFirst()))) {
                    pending.removeFirst();
                }
            }
            if ((stopRequested || finalizeRequested) && pending.isEmpty() && !sentinelsQueued) {
                sentinelsQueued = true;
                sentinelsToSend = workerCount;
            }
            while (sentinelsToSend > 0 && inputChannel.offer(Envelope.stopSignal())) {
                sentinelsToSend--;
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean isSuspended() {
        lock.lock();
        try {
            return suspended;
        } finally {
            lock.unlock();
        }
    }

    private void awaitChange() throws InterruptedException {
        lock.lock();
        try {
            if (suspended) {
                changed.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    private void handle(Message<T, R> message) {
        switch (message.kind()) {
            case OUTCOME -> deliver(processOutcome(message.outcome()));
            case EXITED -> {
                liveWorkers--;
                logger.fine("Worker '" + message.workerName() + "' exited");
            }
            case DIED -> {
                liveWorkers--;
                WorkerPoolException error =
                        new WorkerPoolException(message.workerName(), message.error());
                logger.log(Level.SEVERE, error.getMessage(), message.error());
                stop();
                for (WorkerControllerListener<T, R> listener : listeners) {
                    notifySafely(() -> listener.onWorkerFailure(error));
                }
            }
        }
    }

    private void deliver(TaskOutcome<T, R> outcome) {
        double progress;
        lock.lock();
        try {
            completed++;
            progress = (double) completed / submitted;
        } finally {
            lock.unlock();
        }
        if (!outcome.isSuccess()) {
            logger.warning(
                    "Task " + outcome.task() + " failed: " + outcome.error().getMessage());
        }
        for (WorkerControllerListener<T, R> listener : listeners) {
            if (outcome.isSuccess()) {
                notifySafely(() -> listener.onResult(outcome.task(), outcome.result()));
            } else {
                notifySafely(() -> listener.onFailure(outcome.task(), outcome.error()));
            }
            notifySafely(() -> listener.onProgress(progress));
        }
    }

    private void notifyFinished() {
        try {
            for (WorkerControllerListener<T, R> listener : listeners) {
                notifySafely(listener::onFinished);
            }
        } finally {
            terminated.countDown();
        }
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Listener of '" + name + "' threw an exception", e);
        }
    }

    // -- Channel items ---------------------------------------------------------------------

    private record Envelope<T>(T task, boolean stop) {

        static <T> Envelope<T> of(T task) {
            return new Envelope<>(task, false);
        }

        static <T> Envelope<T> stopSignal() {
            return new Envelope<>(null, true);
        }
    }

    private enum Kind {
        OUTCOME,
        EXITED,
        DIED
    }

    private record Message<T, R>(
            Kind kind, TaskOutcome<T, R> outcome, String workerName, Throwable error) {

        static <T, R> Message<T, R> outcome(TaskOutcome<T, R> outcome) {
            return new Message<>(Kind.OUTCOME, outcome, null, null);
        }

        static <T, R> Message<T, R> exited(String workerName) {
            return new Message<>(Kind.EXITED, null, workerName, null);
        }

        static <T, R> Message<T, R> died(String workerName, Throwable error) {
            return new Message<>(Kind.DIED, null, workerName, error);
        }
    }
}
