package io.scanflow.core;

import io.scanflow.core.export.ResultExportService;
import io.scanflow.core.export.ResultExporter;
import io.scanflow.core.plugin.DefaultPluginRegistry;
import io.scanflow.core.plugin.Plugin;
import io.scanflow.core.plugin.PluginRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link ScanflowEnvironment}s.
///
/// Result exporters are discovered with {@link ServiceLoader} from
/// `META-INF/services/io.scanflow.core.export.ResultExporter`, so adding the serialization
/// module to the class path makes its exporters available. Explicitly added exporters take
/// precedence over discovered ones of the same format.
///
/// ### Usage
/// {@snippet :
/// var env = ScanflowFactory.builder()
///     .config(ScanflowConfig.builder().workerCount(4).build())
///     .plugin(DetectorLoader.class, DetectorLoader::new)
///     .build();
/// }
///
/// @see ScanflowEnvironment
/// @see ScanflowConfig
public final class ScanflowFactory {

    private static final Logger logger = Logger.getLogger(ScanflowFactory.class.getName());

    private ScanflowFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and an empty plugin registry.
    ///
    /// @return a fully wired environment, never null
    public static ScanflowEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates an environment with the given configuration and an empty plugin registry.
    ///
    /// @param config configuration, not null
    /// @return a fully wired environment, never null
    public static ScanflowEnvironment createEnvironment(ScanflowConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder.
    ///
    /// @return builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Loads all result exporters available through {@link ServiceLoader}.
    ///
    /// @return discovered exporters, may be empty, never null
    static List<ResultExporter> discoverExporters() {
        List<ResultExporter> discovered = new ArrayList<>();
        for (ResultExporter exporter : ServiceLoader.load(ResultExporter.class)) {
            discovered.add(exporter);
            logger.fine("Discovered result exporter: " + exporter.getFormat());
        }
        return discovered;
    }

    /// Fluent builder for {@link ScanflowEnvironment}.
    public static class Builder {
        private ScanflowConfig config = new ScanflowConfig();
        private PluginRegistry pluginRegistry = new DefaultPluginRegistry();
        private final List<ResultExporter> exporters = new ArrayList<>();
        private boolean discoverExporters = true;

        /// Sets the configuration.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(ScanflowConfig config) {
            this.config = config;
            return this;
        }

        /// Replaces the plugin registry.
        ///
        /// @param pluginRegistry the registry, not null
        /// @return this builder for chaining, never null
        public Builder pluginRegistry(PluginRegistry pluginRegistry) {
            this.pluginRegistry = pluginRegistry;
            return this;
        }

        /// Registers a plugin factory.
        ///
        /// @param pluginClass plugin class, not null
        /// @param factory creates fresh instances, not null
        /// @return this builder for chaining, never null
        public <T extends Plugin> Builder plugin(Class<T> pluginClass, Supplier<T> factory) {
            pluginRegistry.register(pluginClass, factory);
            return this;
        }

        /// Adds a result exporter.
        ///
        /// @param exporter exporter, not null
        /// @return this builder for chaining, never null
        public Builder exporter(ResultExporter exporter) {
            exporters.add(exporter);
            return this;
        }

        /// Enables or disables {@link ServiceLoader} discovery of exporters.
        ///
        /// @param discover `true` to discover exporters on the class path
        /// @return this builder for chaining, never null
        public Builder discoverExporters(boolean discover) {
            this.discoverExporters = discover;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return a fully wired environment, never null
        public ScanflowEnvironment build() {
            List<ResultExporter> all = new ArrayList<>();
            if (discoverExporters) {
                all.addAll(ScanflowFactory.discoverExporters());
            }
            all.addAll(exporters);
            ResultExportService exportService = new ResultExportService(all);
            logger.info(
                    "Created environment with "
                            + config.getWorkerCount()
                            + " workers and exporters "
                            + exportService.getFormats());
            return new ScanflowEnvironment(config, pluginRegistry, exportService);
        }
    }
}
