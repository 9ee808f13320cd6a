package io.scanflow.core.testsupport;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.PluginOutput;
import io.scanflow.core.plugin.PluginType;
import io.scanflow.core.plugin.Rank;
import io.scanflow.core.tree.ProcessingTree;
import java.util.Arrays;
import java.util.Map;

/// Passes its input on unchanged, with optional delay and failure injection.
///
/// - `delay_ms`: sleep before returning
/// - `fail_at`: throws for this scan index (-1 never)
/// - `error_at`: throws an `Error` for this scan index (-1 never)
/// - `grow_at`: from this scan index on, appends one element to 1D inputs (-1 never)
public class PassThrough extends BasePlugin {

    public static final String DELAY_MS = "delay_ms";
    public static final String FAIL_AT = "fail_at";
    public static final String ERROR_AT = "error_at";
    public static final String GROW_AT = "grow_at";

    public PassThrough() {
        super("Pass through", PluginType.PROCESSING, Rank.ANY, Rank.ANY);
        declareParameter(DELAY_MS, 0);
        declareParameter(FAIL_AT, -1);
        declareParameter(ERROR_AT, -1);
        declareParameter(GROW_AT, -1);
    }

    public static PassThrough with(String parameter, Object value) {
        PassThrough plugin = new PassThrough();
        plugin.setParameterValue(parameter, value);
        return plugin;
    }

    @Override
    public PluginOutput execute(Dataset input, Map<String, Object> options) throws Exception {
        int task = ((Number) options.get(ProcessingTree.GLOBAL_INDEX)).intValue();
        int delay = getInt(DELAY_MS);
        if (delay > 0) {
            Thread.sleep(delay);
        }
        if (task == getInt(FAIL_AT)) {
            throw new IllegalStateException("injected failure at task " + task);
        }
        if (task == getInt(ERROR_AT)) {
            throw new AssertionError("injected error at task " + task);
        }
        int growAt = getInt(GROW_AT);
        if (growAt >= 0 && task >= growAt && input.getRank() == 1) {
            double[] grown = Arrays.copyOf(input.getData(), input.getSize() + 1);
            return new PluginOutput(Dataset.of(grown), options);
        }
        return new PluginOutput(input, options);
    }
}
