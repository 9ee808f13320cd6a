package io.scanflow.core.execution.pool;

/// Function applied by a worker to each task.
///
/// Every worker owns its own instance, so implementations may keep unsynchronized state.
///
/// @param <T> task type
/// @param <R> result type
@FunctionalInterface
public interface TaskFunction<T, R> {

    /// Processes one task.
    ///
    /// @param task the task, never null
    /// @return the result
    /// @throws Exception if the task fails; the failure is reported for this task only
    R apply(T task) throws Exception;
}
