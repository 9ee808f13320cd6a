package io.scanflow.core.scan;

import java.util.Map;
import java.util.Objects;

/// Everything a processing run needs to know about its surroundings.
///
/// Carries the scan geometry and a free-form experiment description (detector, beam
/// energy and the like). Passed explicitly into tree execution, the result store and the
/// run coordinator.
///
/// @param scan scan geometry, not null
/// @param experiment experiment description, not null (may be empty)
public record ProcessingContext(Scan scan, Map<String, Object> experiment) {

    public ProcessingContext {
        Objects.requireNonNull(scan, "scan must not be null");
        experiment = experiment != null ? Map.copyOf(experiment) : Map.of();
    }

    /// Creates a context without experiment description.
    ///
    /// @param scan scan geometry, not null
    /// @return new context, never null
    public static ProcessingContext of(Scan scan) {
        return new ProcessingContext(scan, Map.of());
    }
}
