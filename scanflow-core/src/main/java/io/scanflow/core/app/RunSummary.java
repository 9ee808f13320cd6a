package io.scanflow.core.app;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/// Outcome of a parallel run.
///
/// @param submitted number of submitted tasks
/// @param succeeded number of tasks whose results were stored
/// @param failures failure cause by task, not null
/// @param aborted true if the run was aborted before all tasks were processed
/// @param elapsed wall-clock duration of the run, not null
public record RunSummary(
        int submitted,
        int succeeded,
        Map<Integer, Throwable> failures,
        boolean aborted,
        Duration elapsed) {

    public RunSummary {
        failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    }

    public int failed() {
        return failures.size();
    }

    /// Returns whether every submitted task was processed successfully.
    ///
    /// @return true if nothing failed and the run was not aborted
    public boolean isComplete() {
        return !aborted && failures.isEmpty() && succeeded == submitted;
    }
}
