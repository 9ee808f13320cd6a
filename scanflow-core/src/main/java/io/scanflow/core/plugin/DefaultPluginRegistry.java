package io.scanflow.core.plugin;

import io.scanflow.core.exception.PluginNotFoundException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/// Thread-safe in-memory plugin registry.
///
/// Workers look up factories concurrently while cloning their trees, so the backing map is
/// concurrent.
public class DefaultPluginRegistry implements PluginRegistry {

    private final Map<String, Supplier<? extends Plugin>> factories = new ConcurrentHashMap<>();

    @Override
    public void register(String pluginClassName, Supplier<? extends Plugin> factory) {
        if (pluginClassName == null || pluginClassName.isBlank()) {
            throw new IllegalArgumentException("pluginClassName cannot be null or blank");
        }
        factories.put(pluginClassName, Objects.requireNonNull(factory, "factory cannot be null"));
    }

    @Override
    public Optional<Plugin> createPlugin(String pluginClassName) {
        Supplier<? extends Plugin> factory = factories.get(pluginClassName);
        return factory != null ? Optional.of(factory.get()) : Optional.empty();
    }

    @Override
    public Plugin createPluginOrThrow(String pluginClassName) throws PluginNotFoundException {
        return createPlugin(pluginClassName)
                .orElseThrow(
                        () ->
                                new PluginNotFoundException(
                                        "No plugin registered for class: " + pluginClassName));
    }

    @Override
    public boolean hasPlugin(String pluginClassName) {
        return factories.containsKey(pluginClassName);
    }

    @Override
    public Set<String> getRegisteredNames() {
        return Set.copyOf(factories.keySet());
    }
}
