package com.pcat.sync.reconcile;

import com.pcat.store.PluginDescriptor;

import java.util.Objects;

/**
 * A descriptor about to be reconciled, with the archive entry it was parsed from.
 *
 * @param source archive entry name, used in per-item log lines
 * @param plugin parsed descriptor
 */
public record CatalogCandidate(String source, PluginDescriptor plugin) {

    public CatalogCandidate {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(plugin, "plugin");
    }
}
