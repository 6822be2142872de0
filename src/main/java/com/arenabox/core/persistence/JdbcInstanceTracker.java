package com.arenabox.core.persistence;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.model.Instance;
import com.arenabox.core.model.InstanceKey;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.ParticipantKind;
import com.arenabox.core.model.PortMapping;
import com.arenabox.core.model.SandboxKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link InstanceTracker}. Timestamps are stored as epoch seconds.
 * <p>
 * The unique constraint on the instance key is what rejects a second insert for the same
 * participant, challenge and image; the table is created by {@link #createTables()}.
 */
public class JdbcInstanceTracker implements InstanceTracker {

    private static final Logger log = LoggerFactory.getLogger(JdbcInstanceTracker.class);

    private static final String TABLE_NAME = "sandbox_instances";

    /** SQLSTATE for unique constraint violations in both PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String COLUMNS = """
            id, participant_kind, participant_id, challenge_id, image, sandbox_kind,
            handle, ports, host, created_at, revert_eligible_at""";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                 BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                participant_kind   VARCHAR(16)   NOT NULL,
                participant_id     VARCHAR(64)   NOT NULL,
                challenge_id       BIGINT        NOT NULL,
                image              VARCHAR(255)  NOT NULL,
                sandbox_kind       VARCHAR(16)   NOT NULL,
                handle             VARCHAR(128)  NOT NULL,
                ports              VARCHAR(1024) NOT NULL,
                host               VARCHAR(255)  NOT NULL,
                created_at         BIGINT        NOT NULL,
                revert_eligible_at BIGINT        NOT NULL,
                CONSTRAINT uq_sandbox_instance_key UNIQUE (participant_kind, participant_id, challenge_id, image)
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_PARTICIPANT_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_sandbox_instances_participant
            ON %s (participant_kind, participant_id, created_at)
            """.formatted(TABLE_NAME);

    private static final String CREATE_HANDLE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_sandbox_instances_handle ON %s (handle)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (participant_kind, participant_id, challenge_id, image, sandbox_kind,
                            handle, ports, host, created_at, revert_eligible_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_KEY_SQL = """
            SELECT %s FROM %s
            WHERE participant_kind = ? AND participant_id = ? AND challenge_id = ? AND image = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_HANDLE_SQL = """
            SELECT %s FROM %s WHERE handle = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_PARTICIPANT_SQL = """
            SELECT %s FROM %s
            WHERE participant_kind = ? AND participant_id = ?
            ORDER BY created_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_STALE_BY_PARTICIPANT_SQL = """
            SELECT %s FROM %s
            WHERE participant_kind = ? AND participant_id = ? AND created_at <= ?
            ORDER BY created_at ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_CHALLENGE_SQL = """
            SELECT %s FROM %s WHERE challenge_id = ? ORDER BY id ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BATCH_SQL = """
            SELECT %s FROM %s WHERE id > ? ORDER BY id ASC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_STALE_BATCH_SQL = """
            SELECT %s FROM %s WHERE id > ? AND created_at <= ? ORDER BY id ASC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String DELETE_BY_KEY_SQL = """
            DELETE FROM %s
            WHERE participant_kind = ? AND participant_id = ? AND challenge_id = ? AND image = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcInstanceTracker(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the instance table and its indexes if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_PARTICIPANT_INDEX_SQL);
            stmt.execute(CREATE_HANDLE_INDEX_SQL);
            log.info("Instance table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Instance> find(InstanceKey key) {
        return query(SELECT_BY_KEY_SQL, "find " + key, stmt -> bindKey(stmt, key))
                .stream().findFirst();
    }

    @Override
    public Optional<Instance> findByHandle(String handle) {
        return query(SELECT_BY_HANDLE_SQL, "find handle " + handle, stmt -> stmt.setString(1, handle))
                .stream().findFirst();
    }

    @Override
    public Instance insert(Instance instance) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, instance.participant().kind().name());
            stmt.setString(2, instance.participant().id());
            stmt.setLong(3, instance.challengeId());
            stmt.setString(4, instance.image());
            stmt.setString(5, instance.kind().name());
            stmt.setString(6, instance.handle());
            stmt.setString(7, PortMapping.join(instance.ports()));
            stmt.setString(8, instance.host());
            stmt.setLong(9, instance.createdAt().getEpochSecond());
            stmt.setLong(10, instance.revertEligibleAt().getEpochSecond());
            stmt.executeUpdate();

            long id = 0;
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (keys.next()) {
                    id = keys.getLong(1);
                }
            }
            log.debug("Tracked instance {} as row {} (handle {})", instance.key(), id, instance.handle());
            return instance.withId(id);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new ConflictException("An instance already exists for " + instance.key(), e);
            }
            throw new IllegalStateException("Failed to insert instance " + instance.key(), e);
        }
    }

    @Override
    public boolean delete(InstanceKey key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_BY_KEY_SQL)) {
            bindKey(stmt, key);
            int deleted = stmt.executeUpdate();
            log.debug("Removed {} tracker row(s) for {}", deleted, key);
            return deleted > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete instance " + key, e);
        }
    }

    @Override
    public List<Instance> findByParticipant(Participant participant) {
        return query(SELECT_BY_PARTICIPANT_SQL, "list " + participant.key(), stmt -> {
            stmt.setString(1, participant.kind().name());
            stmt.setString(2, participant.id());
        });
    }

    @Override
    public List<Instance> findStale(Participant participant, Instant cutoff) {
        return query(SELECT_STALE_BY_PARTICIPANT_SQL, "stale " + participant.key(), stmt -> {
            stmt.setString(1, participant.kind().name());
            stmt.setString(2, participant.id());
            stmt.setLong(3, cutoff.getEpochSecond());
        });
    }

    @Override
    public List<Instance> findByChallenge(long challengeId) {
        return query(SELECT_BY_CHALLENGE_SQL, "challenge " + challengeId, stmt -> stmt.setLong(1, challengeId));
    }

    @Override
    public List<Instance> findBatch(long afterId, int limit) {
        return query(SELECT_BATCH_SQL, "batch after " + afterId, stmt -> {
            stmt.setLong(1, afterId);
            stmt.setInt(2, limit);
        });
    }

    @Override
    public List<Instance> findStaleBatch(Instant cutoff, long afterId, int limit) {
        return query(SELECT_STALE_BATCH_SQL, "stale batch after " + afterId, stmt -> {
            stmt.setLong(1, afterId);
            stmt.setLong(2, cutoff.getEpochSecond());
            stmt.setInt(3, limit);
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<Instance> query(String sql, String description, Binder binder) {
        List<Instance> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Instance query failed (" + description + ")", e);
        }
        return result;
    }

    private static void bindKey(PreparedStatement stmt, InstanceKey key) throws SQLException {
        stmt.setString(1, key.participant().kind().name());
        stmt.setString(2, key.participant().id());
        stmt.setLong(3, key.challengeId());
        stmt.setString(4, key.image());
    }

    private static Instance fromResultSet(ResultSet rs) throws SQLException {
        return new Instance(
                rs.getLong("id"),
                new Participant(ParticipantKind.valueOf(rs.getString("participant_kind")), rs.getString("participant_id")),
                rs.getLong("challenge_id"),
                rs.getString("image"),
                SandboxKind.valueOf(rs.getString("sandbox_kind")),
                rs.getString("handle"),
                PortMapping.parseList(rs.getString("ports")),
                rs.getString("host"),
                Instant.ofEpochSecond(rs.getLong("created_at")),
                Instant.ofEpochSecond(rs.getLong("revert_eligible_at"))
        );
    }
}
