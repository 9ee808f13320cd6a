package io.scanflow.core;

import io.scanflow.core.exception.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/// Configuration of the Scanflow processing environment.
///
/// Controls worker pool sizing, the shared result buffer and autosaving of results. Use the
/// {@link Builder} for fluent configuration, {@link #fromProperties(Properties)} to read a
/// properties file, or the setters for mutable configuration.
///
/// ### Default Values
/// - `workerCount`: number of available processors
/// - `bufferSizeMb`: `100`
/// - `maxBufferSlots`: `20`
/// - `autosaveDirectory`: `null` (autosave disabled)
/// - `autosaveFormats`: empty
/// - `shutdownTimeout`: 10 seconds
///
/// ### Property Keys
/// | Key                          | Setting              |
/// |------------------------------|----------------------|
/// | `scanflow.workers`           | worker count         |
/// | `scanflow.buffer.size-mb`    | buffer size in MiB   |
/// | `scanflow.buffer.max-slots`  | max buffer slots     |
/// | `scanflow.autosave.directory`| autosave directory   |
/// | `scanflow.autosave.formats`  | comma-separated list |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link ScanflowFactory}.
///
/// @see ScanflowFactory#createEnvironment(ScanflowConfig)
public class ScanflowConfig {

    public static final String WORKERS_KEY = "scanflow.workers";
    public static final String BUFFER_SIZE_KEY = "scanflow.buffer.size-mb";
    public static final String MAX_SLOTS_KEY = "scanflow.buffer.max-slots";
    public static final String AUTOSAVE_DIRECTORY_KEY = "scanflow.autosave.directory";
    public static final String AUTOSAVE_FORMATS_KEY = "scanflow.autosave.formats";

    private int workerCount = Runtime.getRuntime().availableProcessors();
    private double bufferSizeMb = 100;
    private int maxBufferSlots = 20;
    private Path autosaveDirectory;
    private List<String> autosaveFormats = new ArrayList<>();
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /// Creates a configuration with default values.
    public ScanflowConfig() {}

    /// Reads a configuration from properties. Missing keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws ConfigurationException if a value cannot be parsed or is out of range
    public static ScanflowConfig fromProperties(Properties properties) {
        ScanflowConfig config = new ScanflowConfig();
        String workers = properties.getProperty(WORKERS_KEY);
        if (workers != null) {
            config.setWorkerCount(parseInt(WORKERS_KEY, workers));
        }
        String bufferSize = properties.getProperty(BUFFER_SIZE_KEY);
        if (bufferSize != null) {
            try {
                config.setBufferSizeMb(Double.parseDouble(bufferSize.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        "Invalid value for " + BUFFER_SIZE_KEY + ": " + bufferSize, e);
            }
        }
        String maxSlots = properties.getProperty(MAX_SLOTS_KEY);
        if (maxSlots != null) {
            config.setMaxBufferSlots(parseInt(MAX_SLOTS_KEY, maxSlots));
        }
        String directory = properties.getProperty(AUTOSAVE_DIRECTORY_KEY);
        if (directory != null && !directory.isBlank()) {
            config.setAutosaveDirectory(Path.of(directory.trim()));
        }
        String formats = properties.getProperty(AUTOSAVE_FORMATS_KEY);
        if (formats != null) {
            List<String> parsed = new ArrayList<>();
            for (String format : formats.split(",")) {
                if (!format.isBlank()) {
                    parsed.add(format.trim().toLowerCase());
                }
            }
            config.setAutosaveFormats(parsed);
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + key + ": " + value, e);
        }
    }

    /// Returns the number of worker threads of a parallel run.
    ///
    /// @return worker count, positive
    public int getWorkerCount() {
        return workerCount;
    }

    /// Sets the number of worker threads.
    ///
    /// @param workerCount worker count, must be positive
    /// @throws ConfigurationException if not positive
    public void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new ConfigurationException("Worker count must be positive: " + workerCount);
        }
        this.workerCount = workerCount;
    }

    /// Returns the memory available for the shared result buffer.
    ///
    /// @return size in MiB
    public double getBufferSizeMb() {
        return bufferSizeMb;
    }

    public void setBufferSizeMb(double bufferSizeMb) {
        if (bufferSizeMb <= 0) {
            throw new ConfigurationException("Buffer size must be positive: " + bufferSizeMb);
        }
        this.bufferSizeMb = bufferSizeMb;
    }

    /// Returns the buffer size in bytes.
    ///
    /// @return `bufferSizeMb * 2^20`, rounded down
    public long getBufferSizeBytes() {
        return (long) (bufferSizeMb * 1024 * 1024);
    }

    /// Returns the upper limit on buffer slots, whatever the buffer size allows.
    ///
    /// @return maximum slot count, positive
    public int getMaxBufferSlots() {
        return maxBufferSlots;
    }

    public void setMaxBufferSlots(int maxBufferSlots) {
        if (maxBufferSlots < 1) {
            throw new ConfigurationException(
                    "Maximum buffer slots must be positive: " + maxBufferSlots);
        }
        this.maxBufferSlots = maxBufferSlots;
    }

    /// Returns the directory results are written to after every parallel run.
    ///
    /// @return directory, or null if autosave is disabled
    public Path getAutosaveDirectory() {
        return autosaveDirectory;
    }

    public void setAutosaveDirectory(Path autosaveDirectory) {
        this.autosaveDirectory = autosaveDirectory;
    }

    /// Returns the export formats used by autosave.
    ///
    /// @return format names, never null
    public List<String> getAutosaveFormats() {
        return autosaveFormats;
    }

    public void setAutosaveFormats(List<String> autosaveFormats) {
        this.autosaveFormats = new ArrayList<>(autosaveFormats);
    }

    public boolean isAutosaveEnabled() {
        return autosaveDirectory != null && !autosaveFormats.isEmpty();
    }

    /// Returns how long an aborted run may take to wind down.
    ///
    /// @return timeout, never null
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ScanflowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final ScanflowConfig config = new ScanflowConfig();

        public Builder workerCount(int workerCount) {
            config.setWorkerCount(workerCount);
            return this;
        }

        public Builder bufferSizeMb(double bufferSizeMb) {
            config.setBufferSizeMb(bufferSizeMb);
            return this;
        }

        public Builder maxBufferSlots(int maxBufferSlots) {
            config.setMaxBufferSlots(maxBufferSlots);
            return this;
        }

        /// Enables autosave.
        ///
        /// @param directory target directory, not null
        /// @param formats export formats, e.g. `"json"`
        /// @return this builder for chaining, never null
        public Builder autosave(Path directory, String... formats) {
            config.setAutosaveDirectory(directory);
            config.setAutosaveFormats(List.of(formats));
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            config.setShutdownTimeout(shutdownTimeout);
            return this;
        }

        /// Builds and returns the configured {@link ScanflowConfig} instance.
        ///
        /// @return the configured instance, never null
        public ScanflowConfig build() {
            return config;
        }
    }
}
