package io.scanflow.core.execution.pool;

import java.util.Objects;

/// Result of processing one task: either a value or the error that made the task fail.
///
/// @param task the processed task, not null
/// @param result the result value, null for failed tasks
/// @param error the failure cause, null for successful tasks
/// @param <T> task type
/// @param <R> result type
public record TaskOutcome<T, R>(T task, R result, Throwable error) {

    public TaskOutcome {
        Objects.requireNonNull(task, "task must not be null");
    }

    public static <T, R> TaskOutcome<T, R> success(T task, R result) {
        return new TaskOutcome<>(task, result, null);
    }

    public static <T, R> TaskOutcome<T, R> failure(T task, Throwable error) {
        return new TaskOutcome<>(task, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
