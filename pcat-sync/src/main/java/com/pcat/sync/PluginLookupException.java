package com.pcat.sync;

/** The catalog could not supply the requested plugin (missing entry or store failure). */
public final class PluginLookupException extends RuntimeException {

    private final String name;
    private final String version;

    public PluginLookupException(String name, String version, Throwable cause) {
        super("could not lookup plugin: name=" + name + ", version=" + version
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.name = name;
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }
}
