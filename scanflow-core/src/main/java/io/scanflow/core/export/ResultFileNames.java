package io.scanflow.core.export;

import java.util.regex.Pattern;

/// File naming of exported node results: `node_<id>_<label>_<plugin-class>.<ext>`.
///
/// The id is zero-padded to two digits. The label is reduced to letters, digits, `-` and `_`
/// and left out when blank. The plugin class is the simple class name.
public final class ResultFileNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]+");

    private ResultFileNames() {}

    /// Builds the file name for a node result.
    ///
    /// @param nodeId node id
    /// @param label node label, may be null
    /// @param pluginClassName plugin class name, simple or fully qualified, not null
    /// @param extension file extension without dot, not null
    /// @return file name, never null
    public static String fileName(
            int nodeId, String label, String pluginClassName, String extension) {
        StringBuilder name = new StringBuilder(String.format("node_%02d", nodeId));
        String safeLabel = sanitize(label);
        if (!safeLabel.isEmpty()) {
            name.append('_').append(safeLabel);
        }
        String simpleClass = pluginClassName.substring(pluginClassName.lastIndexOf('.') + 1);
        name.append('_').append(sanitize(simpleClass));
        return name.append('.').append(extension).toString();
    }

    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String safe = UNSAFE.matcher(text.trim()).replaceAll("_");
        // collapse separators left at the edges
        return safe.replaceAll("^_+|_+$", "");
    }
}
