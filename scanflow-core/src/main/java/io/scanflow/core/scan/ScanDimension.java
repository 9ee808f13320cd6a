package io.scanflow.core.scan;

import java.util.Objects;

/// One axis of a scan grid.
///
/// Positions along the axis are `offset + delta * i` for `i` in `[0, points)`.
///
/// @param label axis label, not null
/// @param unit axis unit, not null
/// @param offset position of the first point
/// @param delta step between consecutive points
/// @param points number of points, at least 1
public record ScanDimension(String label, String unit, double offset, double delta, int points) {

    public ScanDimension {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(unit, "unit must not be null");
        if (points < 1) {
            throw new IllegalArgumentException(
                    "Scan dimension '" + label + "' needs at least one point, got " + points);
        }
    }

    /// Creates an index-only dimension with offset 0 and delta 1.
    ///
    /// @param label axis label, not null
    /// @param points number of points
    /// @return new dimension, never null
    public static ScanDimension indexed(String label, int points) {
        return new ScanDimension(label, "", 0.0, 1.0, points);
    }

    /// Returns the positions of all points along this axis.
    ///
    /// @return new array of length `points`, never null
    public double[] range() {
        double[] range = new double[points];
        for (int i = 0; i < points; i++) {
            range[i] = offset + delta * i;
        }
        return range;
    }
}
