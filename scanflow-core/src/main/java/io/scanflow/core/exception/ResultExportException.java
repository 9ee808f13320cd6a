package io.scanflow.core.exception;

import java.io.Serial;

/// Unchecked wrapper for I/O failures while exporting node results.
///
/// @see io.scanflow.core.export.ResultExporter
public class ResultExportException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2217603378245770986L;

    public ResultExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
