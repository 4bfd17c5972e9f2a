package com.pcat.store;

import java.util.Objects;

/**
 * Catalog entry for one plugin. {@link #getIdentifier()} is the catalog primary key; {@link #getSpec()} holds the
 * manifest text exactly as read from the archive. Null text fields are normalized to the empty string so a
 * descriptor read back from storage compares equal to the one that was written.
 */
public final class PluginDescriptor {

    private final String identifier;
    private final String type;
    private final String description;
    private final String version;
    private final String spec;
    private final String logo;

    public PluginDescriptor(String identifier, String type, String description, String version, String spec, String logo) {
        String id = Objects.requireNonNull(identifier, "identifier").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Plugin identifier must be non-blank");
        }
        this.identifier = id;
        this.type = orEmpty(type);
        this.description = orEmpty(description);
        this.version = orEmpty(version);
        this.spec = orEmpty(spec);
        this.logo = orEmpty(logo);
    }

    private static String orEmpty(String s) {
        return s != null ? s : "";
    }

    public String getIdentifier() {
        return identifier;
    }

    /** Plugin type from the manifest header (e.g. step, stage). */
    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /** Declared manifest version; empty when the manifest declares none. Not part of content identity. */
    public String getVersion() {
        return version;
    }

    /** Raw manifest text. */
    public String getSpec() {
        return spec;
    }

    /** Logo markup (e.g. SVG); empty when the plugin ships no logo. */
    public String getLogo() {
        return logo;
    }

    public boolean hasLogo() {
        return !logo.isEmpty();
    }

    /**
     * Content identity check: same identifier and exactly equal type, description, spec and logo.
     * A descriptor that matches the stored one needs no write.
     */
    public boolean matches(PluginDescriptor other) {
        if (other == null) return false;
        return identifier.equals(other.identifier)
                && type.equals(other.type)
                && description.equals(other.description)
                && spec.equals(other.spec)
                && logo.equals(other.logo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginDescriptor that = (PluginDescriptor) o;
        return matches(that) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, type, description, version, spec, logo);
    }

    @Override
    public String toString() {
        return "PluginDescriptor{identifier=" + identifier + ", type=" + type + ", version=" + version
                + ", specLength=" + spec.length() + ", hasLogo=" + hasLogo() + "}";
    }
}
