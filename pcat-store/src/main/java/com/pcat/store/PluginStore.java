package com.pcat.store;

import java.util.List;

/**
 * Persistent catalog of {@link PluginDescriptor}s addressed by identifier.
 * All methods block; failures surface as {@link PluginStoreException}.
 */
public interface PluginStore {

    /** Returns every catalog entry. Used once per populate pass to build the in-memory index. */
    List<PluginDescriptor> listAll();

    /**
     * Finds a plugin by identifier and version.
     *
     * @param identifier plugin identifier (manifest name)
     * @param version    declared version; null/blank matches any version
     * @throws PluginNotFoundException when no entry matches
     */
    PluginDescriptor find(String identifier, String version);

    /**
     * Creates a new entry.
     *
     * @throws PluginStoreException when the identifier already exists or the write fails
     */
    void create(PluginDescriptor plugin);

    /**
     * Replaces the entry with the same identifier.
     *
     * @throws PluginNotFoundException when no entry with that identifier exists
     */
    void update(PluginDescriptor plugin);

    /** Returns one page of entries ordered by identifier. */
    List<PluginDescriptor> list(PluginFilter filter);

    /** Counts entries matching the filter's query (paging ignored). */
    long count(PluginFilter filter);
}
