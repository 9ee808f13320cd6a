package io.scanflow.core.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// N-dimensional array of `double` values with per-axis metadata.
///
/// Data is stored flat in row-major order. Rank 0 datasets hold a single scalar value.
/// Besides the shape, a dataset carries a label, unit and numeric range per axis and a
/// label and unit for the values themselves.
///
/// ### Contracts
/// - **Invariant**: `data.length` equals the product of the shape entries
/// - **Invariant**: there is exactly one `AxisMetadata` entry per axis
///
/// @implNote **Not thread-safe**. Plugins receive their own copy whenever a result is
/// fanned out to more than one consumer.
public final class Dataset {

    private final int[] shape;
    private final double[] data;
    private final List<AxisMetadata> axes;
    private String dataLabel = "";
    private String dataUnit = "";

    private Dataset(int[] shape, double[] data, List<AxisMetadata> axes) {
        this.shape = shape;
        this.data = data;
        this.axes = axes;
    }

    /// Creates a rank-0 dataset holding one value.
    ///
    /// @param value the scalar value
    /// @return new dataset, never null
    public static Dataset scalar(double value) {
        return new Dataset(new int[0], new double[] {value}, new ArrayList<>());
    }

    /// Creates a dataset from a shape and flat row-major data.
    ///
    /// @param shape axis lengths, not null, entries not negative
    /// @param data flat values, not null, length must match the shape
    /// @return new dataset with default axis metadata, never null
    /// @throws IllegalArgumentException if the data length does not match the shape
    public static Dataset of(int[] shape, double[] data) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(data, "data must not be null");
        int size = sizeOf(shape);
        if (data.length != size) {
            throw new IllegalArgumentException(
                    "Data length "
                            + data.length
                            + " does not match shape "
                            + Arrays.toString(shape));
        }
        List<AxisMetadata> axes = new ArrayList<>(shape.length);
        for (int length : shape) {
            axes.add(AxisMetadata.indexAxis(length));
        }
        return new Dataset(shape.clone(), data.clone(), axes);
    }

    /// Creates a one-dimensional dataset.
    ///
    /// @param values the values, not null
    /// @return new rank-1 dataset, never null
    public static Dataset of(double... values) {
        return of(new int[] {values.length}, values);
    }

    /// Creates a dataset of the given shape with every element set to `value`.
    ///
    /// @param shape axis lengths, not null
    /// @param value fill value
    /// @return new dataset, never null
    public static Dataset filled(int[] shape, double value) {
        double[] data = new double[sizeOf(shape)];
        Arrays.fill(data, value);
        return of(shape, data);
    }

    /// Returns the number of elements for a shape.
    ///
    /// @param shape axis lengths, not null
    /// @return product of all axis lengths (1 for rank 0)
    /// @throws IllegalArgumentException if an axis length is negative
    public static int sizeOf(int[] shape) {
        int size = 1;
        for (int length : shape) {
            if (length < 0) {
                throw new IllegalArgumentException(
                        "Negative axis length in shape " + Arrays.toString(shape));
            }
            size = Math.multiplyExact(size, length);
        }
        return size;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int getSize() {
        return data.length;
    }

    /// Checks whether this dataset has exactly the given shape.
    ///
    /// @param other shape to compare with, not null
    /// @return true if rank and all axis lengths match
    public boolean hasShape(int[] other) {
        return Arrays.equals(shape, other);
    }

    /// Returns the element at a multi-dimensional index.
    ///
    /// @param index one position per axis (empty for scalars)
    /// @return the element value
    /// @throws IndexOutOfBoundsException if the index does not address an element
    public double get(int... index) {
        return data[flatIndex(index)];
    }

    /// Sets the element at a multi-dimensional index.
    ///
    /// @param value new value
    /// @param index one position per axis
    public void set(double value, int... index) {
        data[flatIndex(index)] = value;
    }

    /// Returns the first element. Convenient for scalar datasets.
    ///
    /// @return first element value
    public double getScalarValue() {
        return data[0];
    }

    /// Returns a copy of the flat row-major data.
    ///
    /// @return new array, never null
    public double[] getData() {
        return data.clone();
    }

    /// Copies the flat data into a target array.
    ///
    /// @param target destination array, not null
    /// @param offset start position in the destination
    void copyDataInto(double[] target, int offset) {
        System.arraycopy(data, 0, target, offset, data.length);
    }

    /// Returns the metadata of all axes.
    ///
    /// @return unmodifiable list, one entry per axis
    public List<AxisMetadata> getAxes() {
        return Collections.unmodifiableList(axes);
    }

    public AxisMetadata getAxis(int axis) {
        return axes.get(axis);
    }

    /// Replaces the metadata of one axis.
    ///
    /// @param axis axis position
    /// @param metadata new metadata, not null; a range must match the axis length
    /// @return this dataset for chaining
    /// @throws IllegalArgumentException if the range length does not match the axis length
    public Dataset withAxis(int axis, AxisMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        double[] range = metadata.range();
        if (range != null && range.length != shape[axis]) {
            throw new IllegalArgumentException(
                    "Range of length "
                            + range.length
                            + " does not fit axis "
                            + axis
                            + " of length "
                            + shape[axis]);
        }
        axes.set(axis, metadata);
        return this;
    }

    /// Replaces the metadata of all axes.
    ///
    /// @param metadata one entry per axis, not null
    /// @return this dataset for chaining
    public Dataset withAxes(List<AxisMetadata> metadata) {
        if (metadata.size() != shape.length) {
            throw new IllegalArgumentException(
                    "Expected " + shape.length + " axis entries, got " + metadata.size());
        }
        for (int i = 0; i < metadata.size(); i++) {
            withAxis(i, metadata.get(i));
        }
        return this;
    }

    public String getDataLabel() {
        return dataLabel;
    }

    public String getDataUnit() {
        return dataUnit;
    }

    public Dataset withDataLabel(String label, String unit) {
        this.dataLabel = label != null ? label : "";
        this.dataUnit = unit != null ? unit : "";
        return this;
    }

    /// Creates a deep copy of values and metadata.
    ///
    /// @return independent copy, never null
    public Dataset copy() {
        Dataset copy = new Dataset(shape.clone(), data.clone(), new ArrayList<>(axes));
        copy.dataLabel = dataLabel;
        copy.dataUnit = dataUnit;
        return copy;
    }

    private int flatIndex(int[] index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException(
                    "Index of rank " + index.length + " for dataset of rank " + shape.length);
        }
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException(
                        "Index " + Arrays.toString(index) + " outside " + Arrays.toString(shape));
            }
            flat = flat * shape[axis] + index[axis];
        }
        return flat;
    }

    /// Compares shape and values. NaN values compare equal to NaN.
    ///
    /// Axis metadata is not part of the comparison.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Dataset{shape=" + Arrays.toString(shape) + ", label='" + dataLabel + "'}";
    }
}
