package io.scanflow.core.exception;

import java.io.Serial;

/// Raised when user-supplied configuration cannot be used for processing.
///
/// Examples: an empty processing tree, a scan index outside the scan, a shared buffer too
/// small for the configured number of workers, or a result shape that is still unknown.
public class ConfigurationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 8830431961550117625L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
