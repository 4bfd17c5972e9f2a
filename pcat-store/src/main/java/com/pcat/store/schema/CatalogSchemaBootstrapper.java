package com.pcat.store.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Single responsibility: load and execute the catalog schema script (table plugins).
 * Idempotent; safe to call at bootstrap.
 */
public final class CatalogSchemaBootstrapper {

    static final String SCHEMA_RESOURCE = "schema/pcat-catalog.sql";
    private static final Logger log = LoggerFactory.getLogger(CatalogSchemaBootstrapper.class);

    private final String schemaResource;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public CatalogSchemaBootstrapper() {
        this(SCHEMA_RESOURCE);
    }

    CatalogSchemaBootstrapper(String schemaResource) {
        this.schemaResource = schemaResource;
    }

    /**
     * Creates catalog tables and indexes if they do not exist. Runs at most once per bootstrapper instance.
     *
     * @throws IllegalStateException when the script cannot be loaded or a statement fails
     */
    public void ensureSchema(ConnectionProvider connectionProvider) {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Catalog schema already initialized; skipping");
            return;
        }
        List<String> statements;
        try {
            statements = statements(loadSchemaScript());
        } catch (IllegalStateException e) {
            schemaInitialized.set(false);
            throw e;
        }
        log.info("Catalog schema: executing {} statement(s) from {}", statements.size(), schemaResource);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                log.debug("Catalog schema: executing statement {}/{}: {}", index, statements.size(), preview);
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Catalog schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}",
                            index, statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    schemaInitialized.set(false);
                    throw new IllegalStateException("Catalog schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Catalog schema: all {} statement(s) executed; table plugins is ready", statements.size());
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Catalog schema: connection failed. error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new IllegalStateException("Catalog schema execution failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on ';' and drops comment-only and empty chunks. */
    static List<String> statements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) {
                out.add(stmt);
            }
        }
        return out;
    }

    private String loadSchemaScript() {
        try (var in = CatalogSchemaBootstrapper.class.getClassLoader().getResourceAsStream(schemaResource)) {
            if (in == null) {
                throw new IllegalStateException("Catalog schema resource not found: " + schemaResource);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            log.error("Catalog schema load failed: resource={}, error={}", schemaResource, e.getMessage(), e);
            throw new IllegalStateException("Catalog schema load failed: " + e.getMessage(), e);
        }
    }

    /** Abstraction for obtaining a connection (shared with the JDBC plugin store). */
    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
