package io.routeweave.core.store;

import io.routeweave.core.model.MtlsSettings;
import io.routeweave.core.model.SecureHeaders;
import io.routeweave.core.model.SecuritySettings;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;

/**
 * Reads and writes the singleton {@code mtls_config} and
 * {@code security_config} rows. A missing row reads as the defaults.
 */
public final class JdbcSettingsStore implements MtlsSettingsProvider, SecuritySettingsProvider {

    private final Database database;
    private final Clock clock;

    public JdbcSettingsStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public JdbcSettingsStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public MtlsSettings mtlsSettings() {
        return database.withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT enabled, ca_cert_path,"
                            + " middleware_rules, middleware_request_headers, middleware_reject_message,"
                            + " middleware_refresh_interval FROM mtls_config WHERE id = 1");
                    ResultSet rows = statement.executeQuery()) {
                if (!rows.next()) {
                    return MtlsSettings.DISABLED;
                }
                return new MtlsSettings(
                        rows.getBoolean(1),
                        nullToEmpty(rows.getString(2)),
                        nullToEmpty(rows.getString(3)),
                        nullToEmpty(rows.getString(4)),
                        nullToEmpty(rows.getString(5)),
                        rows.getInt(6));
            }
        });
    }

    public void saveMtlsSettings(MtlsSettings settings) {
        Timestamp now = Timestamp.from(clock.instant());
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("MERGE INTO mtls_config (id, enabled,"
                    + " ca_cert_path, middleware_rules, middleware_request_headers, middleware_reject_message,"
                    + " middleware_refresh_interval, updated_at) KEY (id) VALUES (1, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setBoolean(1, settings.enabled());
                statement.setString(2, settings.caCertPath());
                statement.setString(3, settings.rules());
                statement.setString(4, settings.requestHeaders());
                statement.setString(5, settings.rejectMessage());
                statement.setInt(6, settings.refreshInterval());
                statement.setTimestamp(7, now);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public SecuritySettings securitySettings() {
        return database.withConnection(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT tls_hardening_enabled,"
                            + " secure_headers_enabled, secure_headers_x_content_type_options,"
                            + " secure_headers_x_frame_options, secure_headers_x_xss_protection, secure_headers_hsts,"
                            + " secure_headers_referrer_policy, secure_headers_csp, secure_headers_permissions_policy"
                            + " FROM security_config WHERE id = 1");
                    ResultSet rows = statement.executeQuery()) {
                if (!rows.next()) {
                    return SecuritySettings.DEFAULTS;
                }
                return new SecuritySettings(
                        rows.getBoolean(1),
                        rows.getBoolean(2),
                        new SecureHeaders(
                                nullToEmpty(rows.getString(3)),
                                nullToEmpty(rows.getString(4)),
                                nullToEmpty(rows.getString(5)),
                                nullToEmpty(rows.getString(6)),
                                nullToEmpty(rows.getString(7)),
                                nullToEmpty(rows.getString(8)),
                                nullToEmpty(rows.getString(9))));
            }
        });
    }

    public void saveSecuritySettings(SecuritySettings settings) {
        Timestamp now = Timestamp.from(clock.instant());
        SecureHeaders headers = settings.headers();
        database.inTransaction(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("MERGE INTO security_config (id,"
                    + " tls_hardening_enabled, secure_headers_enabled, secure_headers_x_content_type_options,"
                    + " secure_headers_x_frame_options, secure_headers_x_xss_protection, secure_headers_hsts,"
                    + " secure_headers_referrer_policy, secure_headers_csp, secure_headers_permissions_policy,"
                    + " updated_at) KEY (id) VALUES (1, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                statement.setBoolean(1, settings.tlsHardeningEnabled());
                statement.setBoolean(2, settings.secureHeadersEnabled());
                statement.setString(3, headers.xContentTypeOptions());
                statement.setString(4, headers.xFrameOptions());
                statement.setString(5, headers.xXssProtection());
                statement.setString(6, headers.hsts());
                statement.setString(7, headers.referrerPolicy());
                statement.setString(8, headers.contentSecurityPolicy());
                statement.setString(9, headers.permissionsPolicy());
                statement.setTimestamp(10, now);
                statement.executeUpdate();
            }
            return null;
        });
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
