package io.scanflow.core.export;

import io.scanflow.core.exception.ConfigurationException;
import io.scanflow.core.exception.ResultExportException;
import io.scanflow.core.result.ResultNodeInfo;
import io.scanflow.core.result.ResultStore;
import io.scanflow.core.scan.ProcessingContext;
import io.scanflow.core.tree.TreeSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Exports the results of all result-producing nodes with the registered exporters.
///
/// One file is written per node and format, named by {@link ResultFileNames}.
public class ResultExportService {

    private static final Logger logger = Logger.getLogger(ResultExportService.class.getName());

    private final Map<String, ResultExporter> exporters = new LinkedHashMap<>();

    /// Creates a service with the given exporters.
    ///
    /// @param exporters exporters keyed by their format, not null
    public ResultExportService(Collection<? extends ResultExporter> exporters) {
        exporters.forEach(this::register);
    }

    public void register(ResultExporter exporter) {
        exporters.put(exporter.getFormat().toLowerCase(), exporter);
    }

    public Optional<ResultExporter> getExporter(String format) {
        return Optional.ofNullable(exporters.get(format.toLowerCase()));
    }

    public Set<String> getFormats() {
        return Set.copyOf(exporters.keySet());
    }

    /// Writes every declared node of a store in every requested format.
    ///
    /// @param directory target directory, created if missing, not null
    /// @param formats format names, not null
    /// @param store results to export, not null
    /// @param tree provenance snapshot of the tree, not null
    /// @param context provenance scan and experiment, not null
    /// @return written files, never null
    /// @throws ConfigurationException if a format has no registered exporter
    /// @throws ResultExportException if a file cannot be written
    public List<Path> exportAll(
            Path directory,
            Collection<String> formats,
            ResultStore store,
            TreeSnapshot tree,
            ProcessingContext context) {
        List<ResultExporter> selected = new ArrayList<>();
        for (String format : formats) {
            selected.add(
                    getExporter(format)
                            .orElseThrow(
                                    () ->
                                            new ConfigurationException(
                                                    "No exporter registered for format '"
                                                            + format
                                                            + "'")));
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ResultExportException("Cannot create export directory " + directory, e);
        }

        List<Path> written = new ArrayList<>();
        for (int nodeId : store.getNodeIds()) {
            NodeResultExport result = describe(nodeId, store, tree, context);
            for (ResultExporter exporter : selected) {
                Path file =
                        directory.resolve(
                                ResultFileNames.fileName(
                                        nodeId,
                                        result.label(),
                                        result.pluginClassName(),
                                        exporter.getExtension()));
                exporter.export(file, result);
                written.add(file);
                logger.fine("Exported node #" + nodeId + " to " + file);
            }
        }
        logger.info("Exported " + written.size() + " result files to " + directory);
        return written;
    }

    private static NodeResultExport describe(
            int nodeId, ResultStore store, TreeSnapshot tree, ProcessingContext context) {
        ResultNodeInfo info =
                store.getNodeInfo(nodeId)
                        .orElse(new ResultNodeInfo(nodeId, "", "", "UnknownPlugin"));
        return new NodeResultExport(
                nodeId,
                info.label(),
                info.pluginName(),
                info.pluginClassName(),
                store.getComposite(nodeId),
                tree,
                context);
    }
}
