package com.pcat.store;

/**
 * Thrown when no catalog entry matches the requested identifier (and version, when given).
 */
public final class PluginNotFoundException extends PluginStoreException {

    private final String identifier;
    private final String version;

    public PluginNotFoundException(String identifier, String version) {
        super(version == null || version.isBlank()
                ? "Plugin not found: " + identifier
                : "Plugin not found: " + identifier + " (version " + version + ")");
        this.identifier = identifier;
        this.version = version;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getVersion() {
        return version;
    }
}
