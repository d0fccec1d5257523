package io.routeweave.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.routeweave.core.model.ResourceStatus;
import io.routeweave.core.model.ServiceRecord;
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

/** {@link ServiceStore} over the {@code services} table. */
public final class JdbcServiceStore implements ServiceStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcServiceStore.class);

    private static final String COLUMNS = "id, name, type, config, source_type, status";

    private final Database database;
    private final Clock clock;

    public JdbcServiceStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcServiceStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public Optional<ServiceRecord> findById(String id) {
        return database.withConnection(connection -> {
            try (PreparedStatement statement =
                    connection.prepareStatement("SELECT " + COLUMNS + " FROM services WHERE id = ?")) {
                statement.setString(1, id);
                try (ResultSet rows = statement.executeQuery()) {
                    return rows.next() ? Optional.of(mapRow(rows)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<ServiceRecord> findActive() {
        return database.withConnection(connection -> {
            List<ServiceRecord> services = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM services WHERE status = ? ORDER BY id")) {
                statement.setString(1, ResourceStatus.ACTIVE.value());
                try (ResultSet rows = statement.executeQuery()) {
                    while (rows.next()) {
                        try {
                            services.add(mapRow(rows));
                        } catch (SQLException e) {
                            LOG.warn("Skipping unreadable service row: {}", e.getMessage());
                        }
                    }
                }
            }
            return services;
        });
    }

    @Override
    public List<String> activeIdsBySourceType(String sourceType) {
        return database.withConnection(connection -> {
            List<String> ids = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT id FROM services WHERE source_type = ? AND status = ? ORDER BY id")) {
                statement.setString(1, sourceType);
                statement.setString(2, ResourceStatus.ACTIVE.value());
                try (ResultSet rows = statement.executeQuery()) {
                    while (rows.next()) {
                        ids.add(rows.getString(1));
                    }
                }
            }
            return ids;
        });
    }

    @Override
    public void save(ServiceRecord service) {
        Timestamp now = Timestamp.from(clock.instant());
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "MERGE INTO services (id, name, type, config, source_type, status, updated_at)"
                            + " KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                statement.setString(1, service.id());
                statement.setString(2, service.name());
                statement.setString(3, service.type());
                statement.setString(4, JsonColumns.write(service.config()));
                statement.setString(5, service.sourceType());
                statement.setString(6, service.status().value());
                statement.setTimestamp(7, now);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void updateDefinition(String id, String type, JsonNode config) {
        Timestamp now = Timestamp.from(clock.instant());
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE services SET type = ?, config = ?, status = ?, updated_at = ? WHERE id = ?")) {
                statement.setString(1, type);
                statement.setString(2, JsonColumns.write(config));
                statement.setString(3, ResourceStatus.ACTIVE.value());
                statement.setTimestamp(4, now);
                statement.setString(5, id);
                if (statement.executeUpdate() == 0) {
                    throw new SQLException("No service with id " + id);
                }
            }
            return null;
        });
    }

    @Override
    public boolean disable(String id) {
        Timestamp now = Timestamp.from(clock.instant());
        return database.inTransaction(connection -> {
            try (PreparedStatement statement =
                    connection.prepareStatement("UPDATE services SET status = ?, updated_at = ? WHERE id = ?")) {
                statement.setString(1, ResourceStatus.DISABLED.value());
                statement.setTimestamp(2, now);
                statement.setString(3, id);
                return statement.executeUpdate() > 0;
            }
        });
    }

    private static ServiceRecord mapRow(ResultSet rows) throws SQLException {
        return new ServiceRecord(
                rows.getString("id"),
                rows.getString("name"),
                rows.getString("type"),
                JsonColumns.readObject("config", rows.getString("config")),
                rows.getString("source_type"),
                ResourceStatus.fromValue(rows.getString("status")));
    }
}
