package com.pcat.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link PluginStore}. Useful for local/dev when no database is configured.
 * Entries are kept ordered by identifier.
 */
public final class InMemoryPluginStore implements PluginStore {

    private final Map<String, PluginDescriptor> plugins = new TreeMap<>();

    @Override
    public synchronized List<PluginDescriptor> listAll() {
        return new ArrayList<>(plugins.values());
    }

    @Override
    public synchronized PluginDescriptor find(String identifier, String version) {
        PluginDescriptor p = identifier != null ? plugins.get(identifier.trim()) : null;
        if (p == null || (version != null && !version.isBlank() && !version.trim().equals(p.getVersion()))) {
            throw new PluginNotFoundException(identifier, version);
        }
        return p;
    }

    @Override
    public synchronized void create(PluginDescriptor plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (plugins.putIfAbsent(plugin.getIdentifier(), plugin) != null) {
            throw new PluginStoreException("Plugin already exists: " + plugin.getIdentifier());
        }
    }

    @Override
    public synchronized void update(PluginDescriptor plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (plugins.replace(plugin.getIdentifier(), plugin) == null) {
            throw new PluginNotFoundException(plugin.getIdentifier(), null);
        }
    }

    @Override
    public synchronized List<PluginDescriptor> list(PluginFilter filter) {
        PluginFilter f = filter != null ? filter : PluginFilter.all();
        return plugins.values().stream()
                .filter(p -> f.accepts(p.getIdentifier()))
                .skip(f.offset())
                .limit(f.size())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long count(PluginFilter filter) {
        PluginFilter f = filter != null ? filter : PluginFilter.all();
        return plugins.values().stream().filter(p -> f.accepts(p.getIdentifier())).count();
    }

    public synchronized int size() {
        return plugins.size();
    }
}
