package io.scanflow.core.exception;

import java.io.Serial;

public class PluginNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -1189373023365513418L;

    public PluginNotFoundException(String message) {
        super(message);
    }
}
