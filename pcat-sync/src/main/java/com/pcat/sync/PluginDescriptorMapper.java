package com.pcat.sync;

import com.pcat.manifest.ManifestConfig;
import com.pcat.manifest.ManifestParseException;
import com.pcat.manifest.ManifestParser;
import com.pcat.store.PluginDescriptor;
import com.pcat.sync.extract.ManifestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns an extracted manifest into a catalog descriptor, or skips it. Skips (logged at WARN with the entry name):
 * content that does not parse, manifests that are not step or stage plugins, and manifests without a name.
 */
public final class PluginDescriptorMapper {

    private static final Logger log = LoggerFactory.getLogger(PluginDescriptorMapper.class);

    public Optional<PluginDescriptor> toDescriptor(ManifestEntry entry) {
        ManifestConfig config;
        try {
            config = ManifestParser.parse(entry.manifest());
        } catch (ManifestParseException e) {
            log.warn("could not parse schema into valid config | name={} error={}", entry.name(), e.getMessage());
            return Optional.empty();
        }
        Optional<String> description = config.getPluginDescription();
        if (description.isEmpty()) {
            log.warn("schema did not match a valid plugin schema | name={} kind={} type={}",
                    entry.name(), config.getKind(), config.getType());
            return Optional.empty();
        }
        String identifier = config.getName();
        if (identifier == null || identifier.isBlank()) {
            log.warn("plugin schema has no name | name={}", entry.name());
            return Optional.empty();
        }
        return Optional.of(new PluginDescriptor(
                identifier,
                config.getType(),
                description.get(),
                config.getVersion(),
                entry.manifestText(),
                entry.logoText()));
    }
}
