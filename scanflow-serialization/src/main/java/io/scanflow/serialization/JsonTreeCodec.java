package io.scanflow.serialization;

import io.scanflow.core.exception.PluginNotFoundException;
import io.scanflow.core.plugin.PluginRegistry;
import io.scanflow.core.tree.ProcessingTree;
import io.scanflow.core.tree.TreeCodec;
import io.scanflow.core.tree.TreeSnapshot;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// JSON {@link TreeCodec} with file import and export of whole processing trees.
public class JsonTreeCodec implements TreeCodec {

    private static final Logger logger = Logger.getLogger(JsonTreeCodec.class.getName());

    @Override
    public String dump(TreeSnapshot snapshot) {
        return TreeSerializer.toJson(snapshot);
    }

    @Override
    public TreeSnapshot load(String text) {
        return TreeSerializer.fromJson(text);
    }

    /// Writes a tree to a JSON file.
    ///
    /// @param tree tree to export, not null
    /// @param file target file, overwritten if present, not null
    /// @throws IOException if the file cannot be written
    public void exportTree(ProcessingTree tree, Path file) throws IOException {
        Files.writeString(file, dump(tree.exportSnapshot()), StandardCharsets.UTF_8);
        logger.info("Exported processing tree with " + tree.size() + " nodes to " + file);
    }

    /// Reads a tree from a JSON file.
    ///
    /// @param file source file, not null
    /// @param registry creates the plugins, not null
    /// @return restored tree, never null
    /// @throws IOException if the file cannot be read
    /// @throws PluginNotFoundException if a plugin class is not registered
    /// @throws IllegalArgumentException if the content is malformed or of an unsupported version
    public ProcessingTree importTree(Path file, PluginRegistry registry)
            throws IOException, PluginNotFoundException {
        TreeSnapshot snapshot = load(Files.readString(file, StandardCharsets.UTF_8));
        ProcessingTree tree = new ProcessingTree();
        tree.restore(snapshot, registry);
        logger.info("Imported processing tree with " + tree.size() + " nodes from " + file);
        return tree;
    }

    /// Replaces the content of an existing tree with a tree read from a JSON file.
    ///
    /// @param tree tree to overwrite, not null; unchanged if reading fails
    /// @param file source file, not null
    /// @param registry creates the plugins, not null
    /// @throws IOException if the file cannot be read
    /// @throws PluginNotFoundException if a plugin class is not registered
    public void importInto(ProcessingTree tree, Path file, PluginRegistry registry)
            throws IOException, PluginNotFoundException {
        tree.restore(load(Files.readString(file, StandardCharsets.UTF_8)), registry);
    }
}
