package io.scanflow.serialization;

import io.scanflow.core.data.Dataset;
import io.scanflow.core.plugin.BasePlugin;
import io.scanflow.core.plugin.DefaultPluginRegistry;
import io.scanflow.core.plugin.PluginOutput;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.plugin.PluginType;
import io.scanflow.core.plugin.Rank;
import io.scanflow.core.tree.ProcessingTree;
import java.util.Arrays;
import java.util.Map;

/// Minimal plugins for serialization tests.
final class SamplePlugins {

    private SamplePlugins() {}

    static PluginRegistry registry() {
        PluginRegistry registry = new DefaultPluginRegistry();
        registry.register(Source.class, Source::new);
        registry.register(Scale.class, Scale::new);
        return registry;
    }

    /// source -> {scale x2 "double", scale x0.5}
    static ProcessingTree tree() {
        ProcessingTree tree = new ProcessingTree();
        int root = tree.addNode(new Source(), null);
        Scale doubled = new Scale();
        doubled.setParameterValue(BasePlugin.LABEL, "double");
        tree.addNode(doubled, root);
        Scale halved = new Scale();
        halved.setParameterValue(Scale.FACTOR, 0.5);
        halved.setParameterValue(Scale.MODE, "log");
        tree.addNode(halved, root);
        return tree;
    }

    static class Source extends BasePlugin {

        static final String LENGTH = "length";

        Source() {
            super("Source", PluginType.INPUT, Rank.of(0), Rank.of(1));
            declareParameter(LENGTH, 3);
        }

        @Override
        public PluginOutput execute(Dataset input, Map<String, Object> options) {
            double[] values = new double[getInt(LENGTH)];
            Arrays.fill(values, input.getScalarValue());
            return new PluginOutput(Dataset.of(values).withDataLabel("signal", "V"), options);
        }
    }

    static class Scale extends BasePlugin {

        static final String FACTOR = "factor";
        static final String MODE = "mode";

        Scale() {
            super("Scale", PluginType.PROCESSING, Rank.of(1), Rank.of(1));
            declareParameter(FACTOR, 2.0);
            declareParameter(MODE, "linear");
        }

        @Override
        public PluginOutput execute(Dataset input, Map<String, Object> options) {
            double[] values = input.getData();
            for (int i = 0; i < values.length; i++) {
                values[i] *= getDouble(FACTOR);
            }
            return new PluginOutput(Dataset.of(values), options);
        }
    }
}
