package com.pcat.store;

import com.pcat.store.schema.CatalogSchemaBootstrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC implementation of {@link PluginStore}. Persists to table {@code plugins}
 * (see {@code schema/pcat-catalog.sql}); schema is created at bootstrap via {@link CatalogSchemaBootstrapper}.
 * One connection per call; every statement carries the configured query timeout.
 */
public final class JdbcPluginStore implements PluginStore {

    private static final String TABLE = "plugins";
    private static final String COLUMNS = "plugin_uid, plugin_description, plugin_type, plugin_version, plugin_logo, plugin_spec";
    private static final String SQLSTATE_UNIQUE_VIOLATION = "23505";
    private static final Logger log = LoggerFactory.getLogger(JdbcPluginStore.class);

    private final CatalogSchemaBootstrapper.ConnectionProvider connectionProvider;
    private final int queryTimeoutSeconds;

    public JdbcPluginStore(CatalogSchemaBootstrapper.ConnectionProvider connectionProvider, int queryTimeoutSeconds) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
    }

    @Override
    public List<PluginDescriptor> listAll() {
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY plugin_uid";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            return readAll(ps);
        } catch (SQLException e) {
            throw new PluginStoreException("Failed to list plugins: " + e.getMessage(), e);
        }
    }

    @Override
    public PluginDescriptor find(String identifier, String version) {
        boolean anyVersion = version == null || version.isBlank();
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE plugin_uid = ?"
                + (anyVersion ? "" : " AND plugin_version = ?");
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, identifier);
            if (!anyVersion) {
                ps.setString(2, version.trim());
            }
            List<PluginDescriptor> rows = readAll(ps);
            if (rows.isEmpty()) {
                throw new PluginNotFoundException(identifier, version);
            }
            return rows.get(0);
        } catch (SQLException e) {
            throw new PluginStoreException("Failed to find plugin " + identifier + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void create(PluginDescriptor plugin) {
        Objects.requireNonNull(plugin, "plugin");
        String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ", plugin_created, plugin_updated) VALUES (?,?,?,?,?,?,?,?)";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            Timestamp now = new Timestamp(System.currentTimeMillis());
            ps.setString(1, plugin.getIdentifier());
            ps.setString(2, plugin.getDescription());
            ps.setString(3, plugin.getType());
            ps.setString(4, plugin.getVersion());
            ps.setString(5, plugin.getLogo());
            ps.setString(6, plugin.getSpec());
            ps.setTimestamp(7, now);
            ps.setTimestamp(8, now);
            ps.executeUpdate();
            log.debug("Catalog entry created | plugins | uid={} type={}", plugin.getIdentifier(), plugin.getType());
        } catch (SQLException e) {
            if (SQLSTATE_UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new PluginStoreException("Plugin already exists: " + plugin.getIdentifier(), e);
            }
            throw new PluginStoreException("Failed to create plugin " + plugin.getIdentifier() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void update(PluginDescriptor plugin) {
        Objects.requireNonNull(plugin, "plugin");
        String sql = "UPDATE " + TABLE + " SET plugin_description = ?, plugin_type = ?, plugin_version = ?,"
                + " plugin_logo = ?, plugin_spec = ?, plugin_updated = ? WHERE plugin_uid = ?";
        int rows;
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            ps.setString(1, plugin.getDescription());
            ps.setString(2, plugin.getType());
            ps.setString(3, plugin.getVersion());
            ps.setString(4, plugin.getLogo());
            ps.setString(5, plugin.getSpec());
            ps.setTimestamp(6, new Timestamp(System.currentTimeMillis()));
            ps.setString(7, plugin.getIdentifier());
            rows = ps.executeUpdate();
        } catch (SQLException e) {
            throw new PluginStoreException("Failed to update plugin " + plugin.getIdentifier() + ": " + e.getMessage(), e);
        }
        if (rows == 0) {
            throw new PluginNotFoundException(plugin.getIdentifier(), null);
        }
        log.debug("Catalog entry updated | plugins | uid={} type={}", plugin.getIdentifier(), plugin.getType());
    }

    @Override
    public List<PluginDescriptor> list(PluginFilter filter) {
        PluginFilter f = filter != null ? filter : PluginFilter.all();
        String sql = "SELECT " + COLUMNS + " FROM " + TABLE
                + (f.query() != null ? " WHERE LOWER(plugin_uid) LIKE ?" : "")
                + " ORDER BY plugin_uid LIMIT ? OFFSET ?";
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            int i = 1;
            if (f.query() != null) {
                ps.setString(i++, likePattern(f.query()));
            }
            ps.setInt(i++, f.size());
            ps.setInt(i, f.offset());
            return readAll(ps);
        } catch (SQLException e) {
            throw new PluginStoreException("Failed to list plugins page: " + e.getMessage(), e);
        }
    }

    @Override
    public long count(PluginFilter filter) {
        PluginFilter f = filter != null ? filter : PluginFilter.all();
        String sql = "SELECT COUNT(*) FROM " + TABLE + (f.query() != null ? " WHERE LOWER(plugin_uid) LIKE ?" : "");
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = prepare(c, sql)) {
            if (f.query() != null) {
                ps.setString(1, likePattern(f.query()));
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new PluginStoreException("Failed to count plugins: " + e.getMessage(), e);
        }
    }

    private PreparedStatement prepare(Connection c, String sql) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        if (queryTimeoutSeconds > 0) {
            ps.setQueryTimeout(queryTimeoutSeconds);
        }
        return ps;
    }

    private static List<PluginDescriptor> readAll(PreparedStatement ps) throws SQLException {
        List<PluginDescriptor> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PluginDescriptor(
                        rs.getString("plugin_uid"),
                        rs.getString("plugin_type"),
                        rs.getString("plugin_description"),
                        rs.getString("plugin_version"),
                        rs.getString("plugin_spec"),
                        rs.getString("plugin_logo")));
            }
        }
        return out;
    }

    /** Lower-cased substring pattern; LIKE wildcards in the query are matched literally. */
    static String likePattern(String query) {
        String escaped = query.toLowerCase()
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
