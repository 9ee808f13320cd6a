package io.scanflow.core.plugin;

import io.scanflow.core.data.Dataset;
import java.util.List;
import java.util.Objects;

/// Diagnostic payload a plugin may expose after processing a single point.
///
/// Consumed by visualization tools only; the processing pipeline ignores it.
///
/// @param plotCount number of plots the payload is meant to fill
/// @param items labelled datasets, each tagged with the plot it belongs to
public record DetailedResults(int plotCount, List<Item> items) {

    public DetailedResults {
        items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
    }

    /// One labelled diagnostic dataset.
    ///
    /// @param plot zero-based plot number
    /// @param label item label, not null
    /// @param data diagnostic data, not null
    public record Item(int plot, String label, Dataset data) {}
}
