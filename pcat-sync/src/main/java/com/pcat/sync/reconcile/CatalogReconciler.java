package com.pcat.sync.reconcile;

import com.pcat.store.PluginDescriptor;
import com.pcat.store.PluginStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Applies the minimal set of writes that brings the catalog up to date with a stream of parsed descriptors.
 * <p>
 * Two phases: the existing catalog is indexed by identifier once, then each descriptor is diffed against the index
 * in traversal order. Unchanged descriptors cause no store call; changed ones are updated; unknown identifiers are
 * created. A failed write is logged and skipped. Nothing is ever deleted: catalog entries missing from the archive
 * are left as they are.
 */
public final class CatalogReconciler {

    private static final Logger log = LoggerFactory.getLogger(CatalogReconciler.class);

    private final PluginStore store;

    public CatalogReconciler(PluginStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @param existing full catalog snapshot, as returned by {@link PluginStore#listAll()}
     * @param incoming descriptors parsed from the archive, in archive order
     */
    public ReconcileResult reconcile(List<PluginDescriptor> existing, Stream<CatalogCandidate> incoming) {
        Map<String, PluginDescriptor> index = new HashMap<>();
        for (PluginDescriptor p : existing) {
            index.put(p.getIdentifier(), p);
        }
        Counters counters = new Counters();
        incoming.forEachOrdered(candidate -> apply(index, candidate, counters));
        log.info("added {} new entries to plugins", counters.created);
        if (counters.updated > 0 || counters.failed > 0) {
            log.info("plugin catalog pass: updated={} unchanged={} failed={}", counters.updated, counters.unchanged, counters.failed);
        }
        return new ReconcileResult(counters.created, counters.updated, counters.unchanged, counters.failed);
    }

    private void apply(Map<String, PluginDescriptor> index, CatalogCandidate candidate, Counters counters) {
        PluginDescriptor plugin = candidate.plugin();
        PluginDescriptor current = index.get(plugin.getIdentifier());
        if (current != null && current.matches(plugin)) {
            log.debug("plugin unchanged, skipping | name={} uid={}", candidate.source(), plugin.getIdentifier());
            counters.unchanged++;
            return;
        }
        if (current != null) {
            try {
                store.update(plugin);
            } catch (RuntimeException e) {
                log.warn("could not update plugin | name={} uid={} error={}", candidate.source(), plugin.getIdentifier(), e.getMessage());
                counters.failed++;
                return;
            }
            index.put(plugin.getIdentifier(), plugin);
            counters.updated++;
            log.info("detected changes: updated existing plugin entry | name={} uid={}", candidate.source(), plugin.getIdentifier());
            return;
        }
        try {
            store.create(plugin);
        } catch (RuntimeException e) {
            log.warn("could not create plugin in DB | name={} uid={} error={}", candidate.source(), plugin.getIdentifier(), e.getMessage());
            counters.failed++;
            return;
        }
        index.put(plugin.getIdentifier(), plugin);
        counters.created++;
        log.info("created plugin entry | name={} uid={} type={}", candidate.source(), plugin.getIdentifier(), plugin.getType());
    }

    private static final class Counters {
        int created;
        int updated;
        int unchanged;
        int failed;
    }
}
