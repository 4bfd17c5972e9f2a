package com.pcat.sync;

import com.pcat.config.CatalogConfig;
import com.pcat.config.CatalogConfigurationException;
import com.pcat.manifest.ManifestConfig;
import com.pcat.manifest.ManifestParser;
import com.pcat.store.PluginDescriptor;
import com.pcat.store.PluginStore;
import com.pcat.store.PluginStoreException;
import com.pcat.sync.archive.ArchiveSourceResolver;
import com.pcat.sync.archive.ResolvedArchive;
import com.pcat.sync.extract.ManifestExtractor;
import com.pcat.sync.reconcile.CatalogCandidate;
import com.pcat.sync.reconcile.CatalogReconciler;
import com.pcat.sync.reconcile.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.zip.ZipFile;

/**
 * Keeps the plugin catalog in sync with the configured manifest archive and serves single-plugin lookups.
 * <p>
 * {@link #populate()} runs one blocking pass: resolve the archive, list the catalog, then extract, parse and
 * reconcile each manifest. Per-manifest problems are logged and skipped; archive and catalog-listing failures end
 * the pass. The downloaded archive (if any) is deleted on every exit path.
 */
public final class PluginCatalogManager {

    private static final Logger log = LoggerFactory.getLogger(PluginCatalogManager.class);
    private static final String SETTING = "PCAT_PLUGINS_ZIP_PATH";
    static final String PLUGIN_KIND = "plugin";
    static final String STEP_TYPE = "step";

    private final CatalogConfig config;
    private final PluginStore store;
    private final ArchiveSourceResolver resolver;
    private final ManifestExtractor extractor;
    private final PluginDescriptorMapper mapper;

    public PluginCatalogManager(CatalogConfig config, PluginStore store) {
        this(config, store, ArchiveSourceResolver.fromConfig(config), new ManifestExtractor());
    }

    public PluginCatalogManager(CatalogConfig config, PluginStore store,
                                ArchiveSourceResolver resolver, ManifestExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.mapper = new PluginDescriptorMapper();
    }

    /**
     * Synchronizes the catalog with the archive at {@link CatalogConfig#getPluginsZipPath()}.
     *
     * @throws CatalogConfigurationException when no archive location is configured
     * @throws CatalogSyncException          when the archive cannot be fetched or opened, or the catalog cannot be listed
     */
    public ReconcileResult populate() {
        String location = config.getPluginsZipPath();
        if (location == null || location.isBlank()) {
            throw new CatalogConfigurationException(SETTING, "plugins path not provided to read schemas from");
        }
        try (ResolvedArchive archive = resolve(location);
             ZipFile zip = open(archive)) {
            List<PluginDescriptor> existing = listExisting();
            log.info("Reconciling plugins archive {} against {} catalog entries", location, existing.size());
            Stream<CatalogCandidate> incoming = extractor.extract(zip)
                    .flatMap(entry -> mapper.toDescriptor(entry)
                            .map(plugin -> new CatalogCandidate(entry.name(), plugin))
                            .stream());
            return new CatalogReconciler(store).reconcile(existing, incoming);
        } catch (IOException e) {
            throw new CatalogSyncException("could not close plugins archive: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves a step plugin manifest from the catalog.
     *
     * @throws UnsupportedLookupException when kind is not {@code plugin} or type is not {@code step}
     * @throws PluginLookupException      when the catalog has no matching entry or cannot be read
     * @throws com.pcat.manifest.ManifestParseException when the stored manifest no longer parses
     */
    public ManifestConfig lookup(String name, String kind, String type, String version) {
        if (!PLUGIN_KIND.equals(kind)) {
            throw new UnsupportedLookupException("only plugin kind supported", kind, type);
        }
        if (!STEP_TYPE.equals(type)) {
            throw new UnsupportedLookupException("only step plugins supported", kind, type);
        }
        PluginDescriptor plugin;
        try {
            plugin = store.find(name, version);
        } catch (PluginStoreException e) {
            throw new PluginLookupException(name, version, e);
        }
        return ManifestParser.parse(plugin.getSpec());
    }

    /** Lookup as a function value for resolvers that only need to fetch manifests. */
    public PluginLookup getLookupFn() {
        return this::lookup;
    }

    private ResolvedArchive resolve(String location) {
        try {
            return resolver.resolve(location);
        } catch (IOException e) {
            throw new CatalogSyncException("could not download remote zip: " + e.getMessage(), e);
        }
    }

    private static ZipFile open(ResolvedArchive archive) {
        try {
            return new ZipFile(archive.getPath().toFile());
        } catch (IOException e) {
            throw new CatalogSyncException("could not open zip for reading: " + archive.getPath(), e);
        }
    }

    private List<PluginDescriptor> listExisting() {
        try {
            return store.listAll();
        } catch (PluginStoreException e) {
            throw new CatalogSyncException("could not list plugins: " + e.getMessage(), e);
        }
    }
}
