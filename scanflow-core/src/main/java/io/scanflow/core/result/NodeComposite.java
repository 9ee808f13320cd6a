package io.scanflow.core.result;

import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.data.Dataset;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/// Dense storage of all point results of one node.
///
/// Point results are laid out one after another in flat scan order. Positions that were never
/// written hold NaN.
final class NodeComposite {

    private final int[] pointShape;
    private final int pointSize;
    private final List<AxisMetadata> pointAxes;
    private final String dataLabel;
    private final String dataUnit;
    private final double[] data;
    private final BitSet written;

    NodeComposite(
            int scanPoints,
            int[] pointShape,
            List<AxisMetadata> pointAxes,
            String dataLabel,
            String dataUnit) {
        this.pointShape = pointShape.clone();
        this.pointSize = Dataset.sizeOf(pointShape);
        this.pointAxes = List.copyOf(pointAxes);
        this.dataLabel = dataLabel;
        this.dataUnit = dataUnit;
        this.data = new double[Math.multiplyExact(scanPoints, pointSize)];
        this.written = new BitSet(scanPoints);
        Arrays.fill(data, Double.NaN);
    }

    int[] getPointShape() {
        return pointShape.clone();
    }

    boolean hasPointShape(int[] shape) {
        return Arrays.equals(pointShape, shape);
    }

    int getPointSize() {
        return pointSize;
    }

    List<AxisMetadata> getPointAxes() {
        return pointAxes;
    }

    String getDataLabel() {
        return dataLabel;
    }

    String getDataUnit() {
        return dataUnit;
    }

    void write(int scanIndex, double[] values) {
        System.arraycopy(values, 0, data, scanIndex * pointSize, pointSize);
        written.set(scanIndex);
    }

    double[] read(int from, int to) {
        return Arrays.copyOfRange(data, from * pointSize, to * pointSize);
    }

    int getWrittenCount() {
        return written.cardinality();
    }
}
