package io.scanflow.core.testsupport;

import io.scanflow.core.data.AxisMetadata;
import io.scanflow.core.data.Dataset;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.PluginOutput;
import io.scanflow.core.plugin.PluginType;
import io.scanflow.core.plugin.Rank;
import java.util.Map;

/// Averages the rows of a 2D frame over the column range `[start, stop)`.
///
/// Output is a 1D profile with `stop - start` elements whose axis range holds the column
/// positions.
public class RangeSelector extends BasePlugin {

    public static final String START = "start";
    public static final String STOP = "stop";

    public RangeSelector() {
        super("Range selector", PluginType.PROCESSING, Rank.of(2), Rank.of(1));
        declareParameter(START, 0);
        declareParameter(STOP, 1);
    }

    public static RangeSelector of(int start, int stop) {
        RangeSelector selector = new RangeSelector();
        selector.setParameterValue(START, start);
        selector.setParameterValue(STOP, stop);
        return selector;
    }

    @Override
    public PluginOutput execute(Dataset input, Map<String, Object> options) {
        int start = getInt(START);
        int stop = getInt(STOP);
        int[] shape = input.getShape();
        double[] profile = new double[stop - start];
        double[] positions = new double[stop - start];
        for (int col = start; col < stop; col++) {
            double sum = 0;
            for (int row = 0; row < shape[0]; row++) {
                sum += input.get(row, col);
            }
            profile[col - start] = sum / shape[0];
            positions[col - start] = col;
        }
        Dataset result = Dataset.of(profile).withAxis(0, new AxisMetadata("column", "px", positions));
        return new PluginOutput(result.withDataLabel("mean intensity", "counts"), options);
    }
}
