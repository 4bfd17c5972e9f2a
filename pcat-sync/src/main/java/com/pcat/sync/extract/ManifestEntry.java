package com.pcat.sync.extract;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One manifest read from the archive: its entry name, the manifest bytes, and the optional co-located logo.
 *
 * @param name     archive entry name (e.g. {@code bundle/plugins/docker/plugin.yaml})
 * @param manifest manifest bytes exactly as stored in the archive
 * @param logo     bytes of the sibling {@code logo.svg}; null when absent or unreadable
 */
public record ManifestEntry(String name, byte[] manifest, byte[] logo) {

    public ManifestEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(manifest, "manifest");
    }

    /** Manifest decoded as UTF-8, byte-for-byte. */
    public String manifestText() {
        return new String(manifest, StandardCharsets.UTF_8);
    }

    /** Logo decoded as UTF-8; null when the entry has no logo. */
    public String logoText() {
        return logo != null ? new String(logo, StandardCharsets.UTF_8) : null;
    }

    public boolean hasLogo() {
        return logo != null;
    }
}
