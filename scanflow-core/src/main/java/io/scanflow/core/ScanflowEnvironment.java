package io.scanflow.core;

import io.scanflow.core.app.ScanProcessingApp;
import io.scanflow.core.export.ResultExportService;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.ProcessingTree;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// Container holding the shared components of a Scanflow installation.
///
/// Hands out {@link ScanProcessingApp}s wired with the environment's plugin registry,
/// configuration and exporters. Closing the environment aborts every run started by apps it
/// created.
///
/// ### Contracts
/// - **Precondition**: all constructor parameters are non-null
/// - **Invariant**: component references do not change after construction
///
/// @apiNote Create instances via {@link ScanflowFactory} rather than direct construction.
///
/// @see ScanflowFactory#createEnvironment()
public final class ScanflowEnvironment implements AutoCloseable {

    private final ScanflowConfig config;
    private final PluginRegistry pluginRegistry;
    private final ResultExportService exportService;
    private final List<ScanProcessingApp> apps = new CopyOnWriteArrayList<>();

    /// Creates a new environment.
    ///
    /// @param config run configuration, not null
    /// @param pluginRegistry known plugins, not null
    /// @param exportService registered result exporters, not null
    public ScanflowEnvironment(
            ScanflowConfig config,
            PluginRegistry pluginRegistry,
            ResultExportService exportService) {
        this.config = config;
        this.pluginRegistry = pluginRegistry;
        this.exportService = exportService;
    }

    public ScanflowConfig getConfig() {
        return config;
    }

    public PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }

    public ResultExportService getExportService() {
        return exportService;
    }

    /// Creates an app processing a scan with the given tree.
    ///
    /// @param tree processing tree, not null; its plugins must be registered
    /// @param context scan and experiment, not null
    /// @return new app, never null
    public ScanProcessingApp createApp(ProcessingTree tree, ProcessingContext context) {
        ScanProcessingApp app =
                new ScanProcessingApp(tree, context, pluginRegistry, config, exportService);
        apps.add(app);
        return app;
    }

    /// Aborts the runs of all apps created by this environment.
    @Override
    public void close() {
        apps.forEach(ScanProcessingApp::abort);
        apps.clear();
    }
}
