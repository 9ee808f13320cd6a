package io.scanflow.core.result;

import io.scanflow.core.data.AxisMetadata;
import java.util.List;
import java.util.Objects;

/// Axis and data description of one node's composite result.
///
/// @param shape full shape: scan axes (or the single timeline axis) followed by point axes
/// @param axes one entry per axis, not null
/// @param dataLabel label of the values, not null
/// @param dataUnit unit of the values, not null
public record ResultMetadata(
        int[] shape, List<AxisMetadata> axes, String dataLabel, String dataUnit) {

    public ResultMetadata {
        shape = shape.clone();
        axes = List.copyOf(Objects.requireNonNull(axes, "axes must not be null"));
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }
}
