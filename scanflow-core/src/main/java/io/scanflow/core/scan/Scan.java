package io.scanflow.core.scan;

import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.exception.ConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Immutable geometry of a multi-dimensional scan.
///
/// A scan is a grid of 1 to 4 dimensions. Each grid point is one task. Tasks are addressed
/// either by their flat (chronological) index or by a position vector; the two are related by
/// row-major ordering, so the last dimension varies fastest.
///
/// ### Contracts
/// - **Invariant**: `getPointCount()` equals the product of all dimension sizes
/// - **Invariant**: `getFlatIndex(getIndexPosition(i)) == i` for every valid `i`
///
/// @implNote **Thread-safe**. Instances are immutable and shared by all workers.
///
/// @see ProcessingContext
public final class Scan {

    /// Largest supported number of scan dimensions.
    public static final int MAX_DIMENSIONS = 4;

    private final String title;
    private final List<ScanDimension> dimensions;
    private final int[] shape;
    private final int pointCount;

    private Scan(String title, List<ScanDimension> dimensions) {
        this.title = title;
        this.dimensions = List.copyOf(dimensions);
        this.shape = new int[dimensions.size()];
        int count = 1;
        for (int i = 0; i < shape.length; i++) {
            shape[i] = dimensions.get(i).points();
            count = Math.multiplyExact(count, shape[i]);
        }
        this.pointCount = count;
    }

    /// Creates a scan from its dimensions, slowest first.
    ///
    /// @param title scan title, may be null
    /// @param dimensions 1 to 4 dimensions, not null
    /// @return new scan, never null
    /// @throws ConfigurationException if the number of dimensions is out of range
    public static Scan of(String title, List<ScanDimension> dimensions) {
        Objects.requireNonNull(dimensions, "dimensions must not be null");
        if (dimensions.isEmpty() || dimensions.size() > MAX_DIMENSIONS) {
            throw new ConfigurationException(
                    "A scan needs between 1 and "
                            + MAX_DIMENSIONS
                            + " dimensions, got "
                            + dimensions.size());
        }
        return new Scan(title != null ? title : "", dimensions);
    }

    /// Creates a scan from its dimensions, slowest first.
    ///
    /// @param dimensions 1 to 4 dimensions
    /// @return new scan with an empty title, never null
    public static Scan of(ScanDimension... dimensions) {
        return of("", Arrays.asList(dimensions));
    }

    public String getTitle() {
        return title;
    }

    public List<ScanDimension> getDimensions() {
        return dimensions;
    }

    public ScanDimension getDimension(int dim) {
        return dimensions.get(dim);
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    /// Returns the total number of scan points.
    ///
    /// @return product of all dimension sizes, always positive
    public int getPointCount() {
        return pointCount;
    }

    /// Converts a flat scan index into a position vector.
    ///
    /// @param flatIndex chronological index in `[0, getPointCount())`
    /// @return one index per dimension, never null
    /// @throws ConfigurationException if the index is outside the scan
    public int[] getIndexPosition(int flatIndex) {
        if (flatIndex < 0 || flatIndex >= pointCount) {
            throw new ConfigurationException(
                    "Scan index "
                            + flatIndex
                            + " is outside the scan of "
                            + pointCount
                            + " points");
        }
        int[] position = new int[shape.length];
        int remainder = flatIndex;
        for (int dim = shape.length - 1; dim >= 0; dim--) {
            position[dim] = remainder % shape[dim];
            remainder /= shape[dim];
        }
        return position;
    }

    /// Converts a position vector into a flat scan index.
    ///
    /// @param position one index per dimension, not null
    /// @return chronological index
    /// @throws ConfigurationException if the position does not lie in the scan
    public int getFlatIndex(int[] position) {
        if (position.length != shape.length) {
            throw new ConfigurationException(
                    "Position of rank "
                            + position.length
                            + " does not match scan of rank "
                            + shape.length);
        }
        int flat = 0;
        for (int dim = 0; dim < shape.length; dim++) {
            if (position[dim] < 0 || position[dim] >= shape[dim]) {
                throw new ConfigurationException(
                        "Position "
                                + Arrays.toString(position)
                                + " is outside the scan shape "
                                + Arrays.toString(shape));
            }
            flat = flat * shape[dim] + position[dim];
        }
        return flat;
    }

    /// Returns the positions along one scan dimension.
    ///
    /// @param dim dimension number
    /// @return new array, never null
    public double[] getRange(int dim) {
        return dimensions.get(dim).range();
    }

    /// Returns label, unit and range of one scan dimension.
    ///
    /// @param dim dimension number
    /// @return axis metadata, never null
    public AxisMetadata getAxisMetadata(int dim) {
        ScanDimension dimension = dimensions.get(dim);
        return new AxisMetadata(dimension.label(), dimension.unit(), dimension.range());
    }

    /// Returns axis metadata for all scan dimensions, slowest first.
    ///
    /// @return new list, never null
    public List<AxisMetadata> getAxisMetadata() {
        List<AxisMetadata> axes = new ArrayList<>(dimensions.size());
        for (int dim = 0; dim < dimensions.size(); dim++) {
            axes.add(getAxisMetadata(dim));
        }
        return axes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scan other)) return false;
        return title.equals(other.title) && dimensions.equals(other.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, dimensions);
    }

    @Override
    public String toString() {
        return "Scan{title='" + title + "', shape=" + Arrays.toString(shape) + "}";
    }
}
