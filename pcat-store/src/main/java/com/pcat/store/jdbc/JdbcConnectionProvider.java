package com.pcat.store.jdbc;

import com.pcat.config.CatalogConfig;
import com.pcat.store.schema.CatalogSchemaBootstrapper;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Single responsibility: provide JDBC connections to the catalog database (PostgreSQL, UTC).
 */
public final class JdbcConnectionProvider implements CatalogSchemaBootstrapper.ConnectionProvider {

    private final CatalogConfig config;

    public JdbcConnectionProvider(CatalogConfig config) {
        this.config = Objects.requireNonNull(config, "CatalogConfig");
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    @Override
    public Connection getConnection() throws SQLException {
        // Force UTC so the driver does not send a JVM default zone the server may reject.
        TimeZone prev = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            return DriverManager.getConnection(jdbcUrl(), config.getDbUser(), config.getDbPassword());
        } finally {
            TimeZone.setDefault(prev);
        }
    }
}
