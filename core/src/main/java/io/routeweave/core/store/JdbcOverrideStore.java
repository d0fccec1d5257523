package io.routeweave.core.store;

import io.routeweave.core.model.ActiveResource;
import io.routeweave.core.model.MiddlewareAssignment;
import io.routeweave.core.model.MiddlewareRecord;
import io.routeweave.core.model.Resource;
import io.routeweave.core.model.ResourceStatus;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link OverrideStore} over the middleware and assignment tables. */
public final class JdbcOverrideStore implements OverrideStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOverrideStore.class);

    private final Database database;
    private final Clock clock;

    public JdbcOverrideStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcOverrideStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public List<MiddlewareRecord> middlewares() {
        return database.withConnection(connection -> {
            List<MiddlewareRecord> middlewares = new ArrayList<>();
            try (PreparedStatement statement =
                            connection.prepareStatement("SELECT id, name, type, config FROM middlewares ORDER BY id");
                    ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    try {
                        middlewares.add(new MiddlewareRecord(
                                rows.getString("id"),
                                rows.getString("name"),
                                rows.getString("type"),
                                JsonColumns.readObject("config", rows.getString("config"))));
                    } catch (SQLException e) {
                        LOG.warn("Skipping unreadable middleware row: {}", e.getMessage());
                    }
                }
            }
            return middlewares;
        });
    }

    @Override
    public void saveMiddleware(MiddlewareRecord middleware) {
        Timestamp now = Timestamp.from(clock.instant());
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "MERGE INTO middlewares (id, name, type, config, updated_at) KEY (id) VALUES (?, ?, ?, ?, ?)")) {
                statement.setString(1, middleware.id());
                statement.setString(2, middleware.name());
                statement.setString(3, middleware.type());
                statement.setString(4, JsonColumns.write(middleware.config()));
                statement.setTimestamp(5, now);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public boolean deleteMiddleware(String id) {
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM middlewares WHERE id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void assignMiddleware(String resourceId, String middlewareId, int priority) {
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "MERGE INTO resource_middlewares (resource_id, middleware_id, priority)"
                            + " KEY (resource_id, middleware_id) VALUES (?, ?, ?)")) {
                statement.setString(1, resourceId);
                statement.setString(2, middlewareId);
                statement.setInt(3, priority);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public boolean unassignMiddleware(String resourceId, String middlewareId) {
        return database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "DELETE FROM resource_middlewares WHERE resource_id = ? AND middleware_id = ?")) {
                statement.setString(1, resourceId);
                statement.setString(2, middlewareId);
                return statement.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void assignService(String resourceId, String serviceId) {
        database.inTransaction(connection -> {
            try (PreparedStatement statement =
                    connection.prepareStatement("DELETE FROM resource_services WHERE resource_id = ?")) {
                statement.setString(1, resourceId);
                statement.executeUpdate();
            }
            if (serviceId != null) {
                try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO resource_services (resource_id, service_id) VALUES (?, ?)")) {
                    statement.setString(1, resourceId);
                    statement.setString(2, serviceId);
                    statement.executeUpdate();
                }
            }
            return null;
        });
    }

    @Override
    public List<ActiveResource> activeResources() {
        return database.withConnection(connection -> {
            Map<String, Resource> resources = loadActiveResources(connection);
            Map<String, List<MiddlewareAssignment>> assignments = loadAssignments(connection);
            Map<String, String> services = loadServiceAssignments(connection);

            List<ActiveResource> active = new ArrayList<>(resources.size());
            for (Resource resource : resources.values()) {
                active.add(new ActiveResource(
                        resource,
                        assignments.getOrDefault(resource.id(), List.of()),
                        services.get(resource.id())));
            }
            return active;
        });
    }

    private static Map<String, Resource> loadActiveResources(Connection connection) throws SQLException {
        Map<String, Resource> resources = new LinkedHashMap<>();
        try (PreparedStatement statement =
                connection.prepareStatement("SELECT * FROM resources WHERE status = ? ORDER BY id")) {
            statement.setString(1, ResourceStatus.ACTIVE.value());
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    try {
                        Resource resource = JdbcResourceStore.mapRow(rows);
                        resources.put(resource.id(), resource);
                    } catch (SQLException | IllegalStateException e) {
                        LOG.warn("Skipping unreadable resource row: {}", e.getMessage());
                    }
                }
            }
        }
        return resources;
    }

    private static Map<String, List<MiddlewareAssignment>> loadAssignments(Connection connection)
            throws SQLException {
        Map<String, List<MiddlewareAssignment>> assignments = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("SELECT resource_id, middleware_id, priority"
                        + " FROM resource_middlewares ORDER BY resource_id, priority DESC, middleware_id");
                ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                assignments
                        .computeIfAbsent(rows.getString("resource_id"), id -> new ArrayList<>())
                        .add(new MiddlewareAssignment(rows.getString("middleware_id"), rows.getInt("priority")));
            }
        }
        return assignments;
    }

    private static Map<String, String> loadServiceAssignments(Connection connection) throws SQLException {
        Map<String, String> services = new HashMap<>();
        try (PreparedStatement statement =
                        connection.prepareStatement("SELECT resource_id, service_id FROM resource_services");
                ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                services.putIfAbsent(rows.getString("resource_id"), rows.getString("service_id"));
            }
        }
        return services;
    }
}
