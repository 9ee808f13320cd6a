package io.scanflow.core.plugin;

import io.scanflow.core.scan.ProcessingContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Base class holding the parameter bookkeeping common to all plugins.
///
/// Every plugin carries two generic parameters:
/// - `label` (`String`, default `""`): user label used in result file names
/// - `keep_results` (`Boolean`, default `false`): store results even if the node has children
///
/// Subclasses declare their own parameters with {@link #declareParameter(String, Object)} in
/// their constructor. Values restored from a serialized tree may arrive as any `Number`
/// subtype, so numeric getters convert.
public abstract class BasePlugin implements Plugin {

    public static final String LABEL = "label";
    public static final String KEEP_RESULTS = "keep_results";

    private final String name;
    private final PluginType pluginType;
    private final Rank inputRank;
    private final Rank outputRank;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    protected BasePlugin(String name, PluginType pluginType, Rank inputRank, Rank outputRank) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.pluginType = Objects.requireNonNull(pluginType, "pluginType must not be null");
        this.inputRank = Objects.requireNonNull(inputRank, "inputRank must not be null");
        this.outputRank = Objects.requireNonNull(outputRank, "outputRank must not be null");
        declareParameter(LABEL, "");
        declareParameter(KEEP_RESULTS, Boolean.FALSE);
    }

    /// Declares a parameter with its default value.
    ///
    /// @param parameterName parameter name, not null
    /// @param defaultValue default value
    protected final void declareParameter(String parameterName, Object defaultValue) {
        parameters.put(parameterName, defaultValue);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PluginType getPluginType() {
        return pluginType;
    }

    @Override
    public Rank getInputRank() {
        return inputRank;
    }

    @Override
    public Rank getOutputRank() {
        return outputRank;
    }

    @Override
    public void preExecute(ProcessingContext context) throws Exception {}

    @Override
    public Map<String, Object> getParameterValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @Override
    public void setParameterValue(String parameterName, Object value) {
        if (!parameters.containsKey(parameterName)) {
            throw new IllegalArgumentException(
                    "Plugin '" + name + "' has no parameter '" + parameterName + "'");
        }
        parameters.put(parameterName, value);
    }

    public Object getParameterValue(String parameterName) {
        if (!parameters.containsKey(parameterName)) {
            throw new IllegalArgumentException(
                    "Plugin '" + name + "' has no parameter '" + parameterName + "'");
        }
        return parameters.get(parameterName);
    }

    protected double getDouble(String parameterName) {
        return ((Number) getParameterValue(parameterName)).doubleValue();
    }

    protected int getInt(String parameterName) {
        return ((Number) getParameterValue(parameterName)).intValue();
    }

    protected String getString(String parameterName) {
        Object value = getParameterValue(parameterName);
        return value != null ? value.toString() : "";
    }

    public String getLabel() {
        return getString(LABEL);
    }

    public boolean isKeepResults() {
        Object value = getParameterValue(KEEP_RESULTS);
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', params=" + parameters + "}";
    }
}
