package com.arenabox.core.persistence;

import com.arenabox.core.error.TransportException;
import com.arenabox.core.model.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the single orchestrator configuration row. Nothing is cached: every operation reads the row
 * again, so an update applies to the next operation.
 */
public class OrchestratorConfigStore {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfigStore.class);

    private static final String TABLE_NAME = "orchestrator_config";
    private static final int SINGLETON_ID = 1;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id           INTEGER       NOT NULL PRIMARY KEY,
                hostname     VARCHAR(255),
                tls_enabled  BOOLEAN       NOT NULL,
                ca_cert      TEXT,
                client_cert  TEXT,
                client_key   TEXT,
                repositories VARCHAR(1024)
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT hostname, tls_enabled, ca_cert, client_cert, client_key, repositories
            FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET hostname = ?, tls_enabled = ?, ca_cert = ?, client_cert = ?, client_key = ?,
                          repositories = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (hostname, tls_enabled, ca_cert, client_cert, client_key, repositories, id)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public OrchestratorConfigStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Configuration table '{}' ensured", TABLE_NAME);
        }
    }

    public Optional<OrchestratorConfig> get() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setInt(1, SINGLETON_ID);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new OrchestratorConfig(
                        rs.getString("hostname"),
                        rs.getBoolean("tls_enabled"),
                        rs.getString("ca_cert"),
                        rs.getString("client_cert"),
                        rs.getString("client_key"),
                        OrchestratorConfig.parseRepositories(rs.getString("repositories"))
                ));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read orchestrator configuration", e);
        }
    }

    /**
     * The active configuration; a missing or empty one makes the orchestrator unavailable.
     */
    public OrchestratorConfig require() {
        return get()
                .filter(OrchestratorConfig::isConfigured)
                .orElseThrow(() -> new TransportException("Orchestrator endpoint is not configured"));
    }

    public OrchestratorConfig save(OrchestratorConfig config) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                bind(stmt, config);
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    bind(stmt, config);
                    stmt.executeUpdate();
                }
            }
            log.info("Orchestrator configuration updated: {}", config);
            return config;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save orchestrator configuration", e);
        }
    }

    private static void bind(PreparedStatement stmt, OrchestratorConfig config) throws SQLException {
        // TLS off clears any stored key material
        boolean tls = config.tlsEnabled();
        stmt.setString(1, config.hostname());
        stmt.setBoolean(2, tls);
        stmt.setString(3, tls ? config.caCert() : null);
        stmt.setString(4, tls ? config.clientCert() : null);
        stmt.setString(5, tls ? config.clientKey() : null);
        stmt.setString(6, config.repositories().isEmpty() ? null : String.join(",", config.repositories()));
        stmt.setInt(7, SINGLETON_ID);
    }
}
