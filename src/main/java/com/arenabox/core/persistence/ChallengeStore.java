package com.arenabox.core.persistence;

import com.arenabox.core.model.ChallengeDefinition;
import com.arenabox.core.model.PortSpec;
import com.arenabox.core.model.SandboxKind;
import com.arenabox.core.model.SecretReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores challenge definitions. Secret references of multi-part challenges are kept as a JSON
 * array of {@code {"id": ..., "protected": ...}} objects.
 */
public class ChallengeStore {

    private static final Logger log = LoggerFactory.getLogger(ChallengeStore.class);

    private static final String TABLE_NAME = "challenge_definitions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id            BIGINT        NOT NULL PRIMARY KEY,
                name          VARCHAR(255)  NOT NULL,
                image         VARCHAR(255)  NOT NULL,
                exposed_ports VARCHAR(1024) NOT NULL,
                sandbox_kind  VARCHAR(16)   NOT NULL,
                secrets       VARCHAR(4096) NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET name = ?, image = ?, exposed_ports = ?, sandbox_kind = ?, secrets = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (name, image, exposed_ports, sandbox_kind, secrets, id)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, name, image, exposed_ports, sandbox_kind, secrets FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_REFERENCING_SQL = """
            SELECT id, name, image, exposed_ports, sandbox_kind, secrets FROM %s
            WHERE sandbox_kind = 'MULTI_PART' AND secrets LIKE ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public ChallengeStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Challenge table '{}' ensured", TABLE_NAME);
        }
    }

    public Optional<ChallengeDefinition> findById(long id) {
        List<ChallengeDefinition> rows = query(SELECT_BY_ID_SQL, stmt -> stmt.setLong(1, id));
        return rows.stream().findFirst();
    }

    /**
     * Multi-part challenges whose secret list contains {@code secretId}.
     */
    public List<ChallengeDefinition> findReferencing(String secretId) {
        // LIKE narrows the scan; the JSON is re-checked after parsing
        return query(SELECT_REFERENCING_SQL, stmt -> stmt.setString(1, "%" + secretId + "%")).stream()
                .filter(c -> c.references(secretId))
                .toList();
    }

    public ChallengeDefinition save(ChallengeDefinition challenge) {
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                bind(stmt, challenge);
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    bind(stmt, challenge);
                    stmt.executeUpdate();
                }
            }
            log.info("Saved challenge {} ({}, image {})", challenge.id(), challenge.kind(), challenge.image());
            return challenge;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save challenge " + challenge.id(), e);
        }
    }

    public boolean delete(long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setLong(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete challenge " + id, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<ChallengeDefinition> query(String sql, Binder binder) {
        var result = new ArrayList<ChallengeDefinition>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Challenge query failed", e);
        }
        return result;
    }

    private void bind(PreparedStatement stmt, ChallengeDefinition challenge) throws SQLException {
        stmt.setString(1, challenge.name());
        stmt.setString(2, challenge.image());
        stmt.setString(3, PortSpec.join(challenge.exposedPorts()));
        stmt.setString(4, challenge.kind().name());
        stmt.setString(5, serializeSecrets(challenge.secrets()));
        stmt.setLong(6, challenge.id());
    }

    private ChallengeDefinition fromResultSet(ResultSet rs) throws SQLException {
        String ports = rs.getString("exposed_ports");
        return new ChallengeDefinition(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("image"),
                ports == null || ports.isBlank() ? List.of() : PortSpec.parseList(ports),
                SandboxKind.valueOf(rs.getString("sandbox_kind")),
                deserializeSecrets(rs.getString("secrets"))
        );
    }

    String serializeSecrets(List<SecretReference> secrets) {
        try {
            return objectMapper.writeValueAsString(secrets);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize secret references", e);
        }
    }

    List<SecretReference> deserializeSecrets(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize secret references", e);
        }
    }
}
