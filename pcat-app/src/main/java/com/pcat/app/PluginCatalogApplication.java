package com.pcat.app;

import com.pcat.config.CatalogConfig;
import com.pcat.config.CatalogConfigurationException;
import com.pcat.store.InMemoryPluginStore;
import com.pcat.store.JdbcPluginStore;
import com.pcat.store.PluginStore;
import com.pcat.store.PluginStoreException;
import com.pcat.store.jdbc.JdbcConnectionProvider;
import com.pcat.store.schema.CatalogSchemaBootstrapper;
import com.pcat.sync.CatalogSyncException;
import com.pcat.sync.PluginCatalogManager;
import com.pcat.sync.reconcile.ReconcileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one plugin catalog synchronization pass and exits. Configuration comes from PCAT_* environment variables;
 * with PCAT_CATALOG_DB_ENABLED=false the pass runs against an in-memory catalog, which is useful for validating an
 * archive. An enabled database that cannot be reached fails the run.
 * <p>
 * Exit status: 0 on success, 1 when the pass fails.
 */
public final class PluginCatalogApplication {

    private static final Logger log = LoggerFactory.getLogger(PluginCatalogApplication.class);

    private PluginCatalogApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(CatalogConfig.fromEnvironment()));
    }

    static int run(CatalogConfig config) {
        log.info("Starting plugin catalog sync with {}", config);
        PluginStore store;
        try {
            store = createStore(config);
        } catch (IllegalStateException | PluginStoreException e) {
            log.error("Plugin catalog sync not started: catalog database unavailable: {}", e.getMessage(), e);
            return 1;
        }
        PluginCatalogManager manager = new PluginCatalogManager(config, store);
        try {
            ReconcileResult result = manager.populate();
            log.info("Plugin catalog sync finished: created={} updated={} unchanged={} failed={}",
                    result.created(), result.updated(), result.unchanged(), result.failed());
            return 0;
        } catch (CatalogConfigurationException e) {
            log.error("Plugin catalog sync not started: {} ({})", e.getMessage(), e.getSetting());
            return 1;
        } catch (CatalogSyncException e) {
            log.error("Plugin catalog sync failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    /**
     * JDBC store with the schema in place, or the in-memory catalog when the database is disabled.
     *
     * @throws IllegalStateException when the database is enabled but the schema cannot be created
     */
    static PluginStore createStore(CatalogConfig config) {
        if (!config.isCatalogDbEnabled()) {
            log.info("Catalog database disabled; using in-memory catalog");
            return new InMemoryPluginStore();
        }
        JdbcConnectionProvider connections = new JdbcConnectionProvider(config);
        new CatalogSchemaBootstrapper().ensureSchema(connections);
        log.info("Using catalog database {}", connections.jdbcUrl());
        return new JdbcPluginStore(connections, config.getDbQueryTimeoutSeconds());
    }
}
