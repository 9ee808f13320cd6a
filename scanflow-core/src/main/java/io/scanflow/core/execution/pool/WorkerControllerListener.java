package io.scanflow.core.execution.pool;

import io.scanflow.core.exception.WorkerPoolException;

/// Receives notifications from a {@link WorkerController}.
///
/// All methods have no-op defaults. Notifications are delivered on the controller's listener
/// thread, one at a time, in the order the outcomes were drained.
///
/// ### Callback Lifecycle
/// ```
/// onResult(task, result) | onFailure(task, error)   -- once per completed task
/// onProgress(fraction)                              -- after every completed task
/// onWorkerFailure(error)                            -- at most once, when a worker dies
/// onFinished()                                      -- exactly once, last
/// ```
///
/// @param <T> task type
/// @param <R> result type
public interface WorkerControllerListener<T, R> {

    /// Called after each completed task.
    ///
    /// @param progress completed tasks divided by submitted tasks, in `[0, 1]`
    default void onProgress(double progress) {}

    /// Called for every successful task.
    ///
    /// @param task the task, not null
    /// @param result the task result
    default void onResult(T task, R result) {}

    /// Called for every failed task.
    ///
    /// @param task the task, not null
    /// @param error the failure cause, not null
    default void onFailure(T task, Throwable error) {}

    /// Called when a worker died outside of task processing. The controller stops afterwards.
    ///
    /// @param error describes the dead worker, not null
    default void onWorkerFailure(WorkerPoolException error) {}

    /// Called once all workers have exited and every outcome was delivered.
    default void onFinished() {}
}
