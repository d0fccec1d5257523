package io.routeweave.core.store;

import io.routeweave.core.model.DiscoveredRoute;
import io.routeweave.core.model.Resource;
import io.routeweave.core.model.ResourceMtls;
import io.routeweave.core.model.ResourceStatus;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link ResourceStore} over the {@code resources} table. */
public final class JdbcResourceStore implements ResourceStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcResourceStore.class);

    private static final String COLUMNS = "id, pangolin_router_id, host, service_id, org_id, site_id, status,"
            + " source_type, entrypoints, tls_domains, custom_headers, router_priority, router_priority_manual,"
            + " mtls_enabled, mtls_rules, mtls_request_headers, mtls_reject_message, mtls_reject_code,"
            + " mtls_refresh_interval, mtls_external_data, tls_hardening_enabled, secure_headers_enabled,"
            + " created_at, updated_at";

    private final Database database;
    private final Clock clock;

    public JdbcResourceStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcResourceStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public List<String> activeIds() {
        return database.withConnection(connection -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement statement =
                            connection.prepareStatement("SELECT id FROM resources WHERE status = ? ORDER BY id");
                    ResultSet rows = query(statement, ResourceStatus.ACTIVE.value())) {
                while (rows.next()) {
                    try {
                        ids.add(rows.getString("id"));
                    } catch (SQLException e) {
                        LOG.warn("Skipping unreadable resource row: {}", e.getMessage());
                    }
                }
            }
            return ids;
        });
    }

    @Override
    public Optional<String> findActiveByUpstreamId(String upstreamId) {
        return findId(
                "SELECT id FROM resources WHERE pangolin_router_id = ? AND status = ?",
                upstreamId,
                ResourceStatus.ACTIVE.value());
    }

    @Override
    public Optional<String> findActiveByHost(String host) {
        return findId("SELECT id FROM resources WHERE host = ? AND status = ?", host, ResourceStatus.ACTIVE.value());
    }

    @Override
    public Optional<String> findLegacy(String upstreamId, String host) {
        return findId(
                "SELECT id FROM resources WHERE id = ? OR (pangolin_router_id IS NULL AND host = ?) ORDER BY id",
                upstreamId,
                host);
    }

    @Override
    public Optional<Resource> findById(String id) {
        return database.withConnection(connection -> {
            try (PreparedStatement statement =
                            connection.prepareStatement("SELECT " + COLUMNS + " FROM resources WHERE id = ?");
                    ResultSet rows = query(statement, id)) {
                return rows.next() ? Optional.of(mapRow(rows)) : Optional.empty();
            }
        });
    }

    @Override
    public List<Resource> findAll() {
        return database.withConnection(connection -> {
            List<Resource> resources = new ArrayList<>();
            try (PreparedStatement statement =
                            connection.prepareStatement("SELECT " + COLUMNS + " FROM resources ORDER BY id");
                    ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    try {
                        resources.add(mapRow(rows));
                    } catch (SQLException e) {
                        LOG.warn("Skipping unreadable resource row: {}", e.getMessage());
                    }
                }
            }
            return resources;
        });
    }

    @Override
    public void create(Resource resource) {
        Timestamp now = Timestamp.from(clock.instant());
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO resources (" + COLUMNS
                    + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ResourceMtls mtls = resource.mtls();
                statement.setString(1, resource.id());
                statement.setString(2, resource.upstreamId());
                statement.setString(3, resource.host());
                statement.setString(4, resource.serviceId());
                statement.setString(5, resource.orgId());
                statement.setString(6, resource.siteId());
                statement.setString(7, resource.status().value());
                statement.setString(8, resource.sourceType());
                statement.setString(9, resource.entrypoints());
                statement.setString(10, resource.tlsDomains());
                statement.setString(11, JsonColumns.write(resource.customHeaders()));
                statement.setInt(12, resource.routerPriority());
                statement.setBoolean(13, resource.routerPriorityManual());
                statement.setBoolean(14, mtls.enabled());
                statement.setString(15, mtls.rules());
                statement.setString(16, mtls.requestHeaders());
                statement.setString(17, mtls.rejectMessage());
                statement.setInt(18, mtls.rejectCode());
                statement.setString(19, mtls.refreshInterval());
                statement.setString(20, mtls.externalData());
                statement.setBoolean(21, resource.tlsHardeningEnabled());
                statement.setBoolean(22, resource.secureHeadersEnabled());
                statement.setTimestamp(23, now);
                statement.setTimestamp(24, now);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<String> refreshFromUpstream(String id, String upstreamId, DiscoveredRoute route) {
        Timestamp now = Timestamp.from(clock.instant());
        return database.inTransaction(connection -> {
            List<String> displaced = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                            "SELECT id FROM resources WHERE host = ? AND status = ? AND id <> ? ORDER BY id");
                    ResultSet rows = query(statement, route.host(), ResourceStatus.ACTIVE.value(), id)) {
                while (rows.next()) {
                    displaced.add(rows.getString(1));
                }
            }
            for (String other : displaced) {
                try (PreparedStatement statement =
                        connection.prepareStatement("UPDATE resources SET status = ?, updated_at = ? WHERE id = ?")) {
                    statement.setString(1, ResourceStatus.DISABLED.value());
                    statement.setTimestamp(2, now);
                    statement.setString(3, other);
                    statement.executeUpdate();
                }
            }
            try (PreparedStatement statement = connection.prepareStatement("UPDATE resources SET pangolin_router_id = ?,"
                    + " host = ?, service_id = ?, status = ?, source_type = ?, updated_at = ? WHERE id = ?")) {
                statement.setString(1, upstreamId);
                statement.setString(2, route.host());
                statement.setString(3, route.serviceId());
                statement.setString(4, ResourceStatus.ACTIVE.value());
                statement.setString(5, route.sourceType());
                statement.setTimestamp(6, now);
                statement.setString(7, id);
                if (statement.executeUpdate() == 0) {
                    throw new SQLException("No resource with id " + id);
                }
            }
            if (route.priority() > 0) {
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE resources SET router_priority = ? WHERE id = ? AND router_priority_manual = FALSE")) {
                    statement.setInt(1, route.priority());
                    statement.setString(2, id);
                    statement.executeUpdate();
                }
            }
            return displaced;
        });
    }

    @Override
    public void updateSettings(Resource resource) {
        Timestamp now = Timestamp.from(clock.instant());
        int updated = database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("UPDATE resources SET entrypoints = ?,"
                    + " tls_domains = ?, custom_headers = ?, router_priority = ?, router_priority_manual = ?,"
                    + " mtls_enabled = ?, mtls_rules = ?, mtls_request_headers = ?, mtls_reject_message = ?,"
                    + " mtls_reject_code = ?, mtls_refresh_interval = ?, mtls_external_data = ?,"
                    + " tls_hardening_enabled = ?, secure_headers_enabled = ?, updated_at = ? WHERE id = ?")) {
                ResourceMtls mtls = resource.mtls();
                statement.setString(1, resource.entrypoints());
                statement.setString(2, resource.tlsDomains());
                statement.setString(3, JsonColumns.write(resource.customHeaders()));
                statement.setInt(4, resource.routerPriority());
                statement.setBoolean(5, resource.routerPriorityManual());
                statement.setBoolean(6, mtls.enabled());
                statement.setString(7, mtls.rules());
                statement.setString(8, mtls.requestHeaders());
                statement.setString(9, mtls.rejectMessage());
                statement.setInt(10, mtls.rejectCode());
                statement.setString(11, mtls.refreshInterval());
                statement.setString(12, mtls.externalData());
                statement.setBoolean(13, resource.tlsHardeningEnabled());
                statement.setBoolean(14, resource.secureHeadersEnabled());
                statement.setTimestamp(15, now);
                statement.setString(16, resource.id());
                return statement.executeUpdate();
            }
        });
        if (updated == 0) {
            throw new StoreException("No resource with id " + resource.id());
        }
    }

    @Override
    public boolean disable(String id) {
        Timestamp now = Timestamp.from(clock.instant());
        return database.inTransaction(connection -> {
            try (PreparedStatement statement =
                    connection.prepareStatement("UPDATE resources SET status = ?, updated_at = ? WHERE id = ?")) {
                statement.setString(1, ResourceStatus.DISABLED.value());
                statement.setTimestamp(2, now);
                statement.setString(3, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean delete(String id) {
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM resources WHERE id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    private Optional<String> findId(String sql, String first, String second) {
        return database.withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql);
                    ResultSet rows = query(statement, first, second)) {
                return rows.next() ? Optional.of(rows.getString(1)) : Optional.empty();
            }
        });
    }

    private static ResultSet query(PreparedStatement statement, String... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            statement.setString(i + 1, params[i]);
        }
        return statement.executeQuery();
    }

    static Resource mapRow(ResultSet rows) throws SQLException {
        Timestamp createdAt = rows.getTimestamp("created_at");
        Timestamp updatedAt = rows.getTimestamp("updated_at");
        return Resource.builder()
                .id(rows.getString("id"))
                .upstreamId(rows.getString("pangolin_router_id"))
                .host(rows.getString("host"))
                .serviceId(rows.getString("service_id"))
                .orgId(rows.getString("org_id"))
                .siteId(rows.getString("site_id"))
                .status(ResourceStatus.fromValue(rows.getString("status")))
                .sourceType(nullToEmpty(rows.getString("source_type")))
                .entrypoints(nullToEmpty(rows.getString("entrypoints")))
                .tlsDomains(nullToEmpty(rows.getString("tls_domains")))
                .customHeaders(JsonColumns.readStringMap("custom_headers", rows.getString("custom_headers")))
                .routerPriority(rows.getInt("router_priority"))
                .routerPriorityManual(rows.getBoolean("router_priority_manual"))
                .mtls(new ResourceMtls(
                        rows.getBoolean("mtls_enabled"),
                        nullToEmpty(rows.getString("mtls_rules")),
                        nullToEmpty(rows.getString("mtls_request_headers")),
                        nullToEmpty(rows.getString("mtls_reject_message")),
                        rows.getInt("mtls_reject_code"),
                        nullToEmpty(rows.getString("mtls_refresh_interval")),
                        nullToEmpty(rows.getString("mtls_external_data"))))
                .tlsHardeningEnabled(rows.getBoolean("tls_hardening_enabled"))
                .secureHeadersEnabled(rows.getBoolean("secure_headers_enabled"))
                .createdAt(createdAt == null ? null : createdAt.toInstant())
                .updatedAt(updatedAt == null ? null : updatedAt.toInstant())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
