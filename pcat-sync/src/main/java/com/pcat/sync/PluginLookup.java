package com.pcat.sync;

import com.pcat.manifest.ManifestConfig;

/**
 * Resolves a plugin manifest by name, kind, type and version. Handed to pipeline resolvers that reference plugins.
 */
@FunctionalInterface
public interface PluginLookup {

    ManifestConfig lookup(String name, String kind, String type, String version);
}
