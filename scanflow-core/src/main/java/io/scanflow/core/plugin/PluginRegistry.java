package io.scanflow.core.plugin;

import io.scanflow.core.exception.PluginNotFoundException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/// Registry of plugin factories keyed by plugin class name.
///
/// Used to rebuild plugins when a tree is imported from its serialized form and when the run
/// coordinator clones a tree into each worker.
///
/// @see DefaultPluginRegistry
public interface PluginRegistry {

    /// Registers a factory for a plugin class name.
    ///
    /// @param pluginClassName name reported by {@link Plugin#getPluginClassName()}, not null
    /// @param factory creates fresh plugin instances with default parameters, not null
    void register(String pluginClassName, Supplier<? extends Plugin> factory);

    /// Registers a factory under the fully qualified name of a plugin class.
    ///
    /// @param pluginClass plugin class, not null
    /// @param factory creates fresh plugin instances, not null
    default <T extends Plugin> void register(Class<T> pluginClass, Supplier<T> factory) {
        register(pluginClass.getName(), factory);
    }

    /// Creates a new plugin instance if the name is known.
    ///
    /// @param pluginClassName registered name, not null
    /// @return fresh plugin, or empty if nothing is registered under the name
    Optional<Plugin> createPlugin(String pluginClassName);

    /// Creates a new plugin instance.
    ///
    /// @param pluginClassName registered name, not null
    /// @return fresh plugin, never null
    /// @throws PluginNotFoundException if nothing is registered under the name
    Plugin createPluginOrThrow(String pluginClassName) throws PluginNotFoundException;

    boolean hasPlugin(String pluginClassName);

    /// Returns all registered names.
    ///
    /// @return unmodifiable set, never null
    Set<String> getRegisteredNames();
}
