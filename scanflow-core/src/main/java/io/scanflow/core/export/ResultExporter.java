package io.scanflow.core.export;

import java.nio.file.Path;

/// Writes the composite result of one node to a file.
///
/// @see ResultExportService
public interface ResultExporter {

    /// Returns the format name used in configuration, e.g. `"json"`.
    ///
    /// @return lower-case format name, never null
    String getFormat();

    /// Returns the file extension without the leading dot.
    ///
    /// @return extension, never null
    String getExtension();

    /// Writes one node result.
    ///
    /// @param file target file, not null; an existing file is overwritten
    /// @param result the result and its provenance, not null
    /// @throws io.scanflow.core.exception.ResultExportException if writing fails
    void export(Path file, NodeResultExport result);
}
