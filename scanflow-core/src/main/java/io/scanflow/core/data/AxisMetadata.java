package io.scanflow.core.data;

import java.util.Arrays;
import java.util.Objects;

/// Label, unit and numeric range of one dataset axis.
///
/// @param label axis label, never null (may be empty)
/// @param unit axis unit, never null (may be empty)
/// @param range axis positions, or null when the axis carries no range
public record AxisMetadata(String label, String unit, double[] range) {

    /// Metadata of an axis with no label, unit or range.
    public static final AxisMetadata EMPTY = new AxisMetadata("", "", null);

    public AxisMetadata {
        label = label != null ? label : "";
        unit = unit != null ? unit : "";
        range = range != null ? range.clone() : null;
    }

    /// Creates default metadata for an axis of the given length.
    ///
    /// The range is the index sequence `0 .. length - 1`.
    ///
    /// @param length axis length, not negative
    /// @return metadata with empty label and unit, never null
    public static AxisMetadata indexAxis(int length) {
        double[] range = new double[length];
        for (int i = 0; i < length; i++) {
            range[i] = i;
        }
        return new AxisMetadata("", "", range);
    }

    @Override
    public double[] range() {
        return range != null ? range.clone() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisMetadata other)) return false;
        return label.equals(other.label)
                && unit.equals(other.unit)
                && Arrays.equals(range, other.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, unit, Arrays.hashCode(range));
    }

    @Override
    public String toString() {
        return "AxisMetadata{label='"
                + label
                + "', unit='"
                + unit
                + "', points="
                + (range != null ? range.length : "none")
                + "}";
    }
}
