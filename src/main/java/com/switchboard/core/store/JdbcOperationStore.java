package com.switchboard.core.store;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ClassificationLogEntry;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.ConsumerType;
import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.model.DestinationType;
import com.switchboard.core.model.ExecutionSemantics;
import com.switchboard.core.model.FeedbackType;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.UserFeedback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * JDBC-based {@link OperationStore}. Runs on PostgreSQL in production and on H2 in tests.
 * <p>
 * Every write but a correction is a single statement, so each row is committed
 * atomically. Status changes are compare-and-set updates guarded by the status
 * the transition was validated against; a lost race is re-read and re-validated.
 * A correction locks its operation row for the feedback insert and the update.
 * Recency is tracked by an application-assigned {@code seq} column.
 */
public class JdbcOperationStore implements OperationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcOperationStore.class);

    private static final int MAX_TRANSITION_ATTEMPTS = 10;

    private static final String CREATE_OPERATIONS_SQL = """
            CREATE TABLE IF NOT EXISTS operations (
                id           VARCHAR(64) PRIMARY KEY,
                seq          BIGINT NOT NULL,
                user_request VARCHAR NOT NULL,
                user_id      VARCHAR(255),
                destination  VARCHAR(32),
                consumer     VARCHAR(32),
                semantics    VARCHAR(32),
                confident    BOOLEAN,
                reasoning    VARCHAR,
                status       VARCHAR(32) NOT NULL,
                agent_id     VARCHAR(255),
                created_at   TIMESTAMP NOT NULL,
                updated_at   TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_FEEDBACK_SQL = """
            CREATE TABLE IF NOT EXISTS user_feedback (
                id                    VARCHAR(64) PRIMARY KEY,
                seq                   BIGINT NOT NULL,
                operation_id          VARCHAR(64) NOT NULL REFERENCES operations(id),
                user_id               VARCHAR(255),
                feedback_type         VARCHAR(32) NOT NULL,
                system_destination    VARCHAR(32),
                system_consumer       VARCHAR(32),
                system_semantics      VARCHAR(32),
                system_confident      BOOLEAN,
                system_reasoning      VARCHAR,
                corrected_destination VARCHAR(32),
                corrected_consumer    VARCHAR(32),
                corrected_semantics   VARCHAR(32),
                correction_reasoning  VARCHAR,
                created_at            TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_CLASSIFICATION_LOG_SQL = """
            CREATE TABLE IF NOT EXISTS classification_log (
                id           VARCHAR(64) PRIMARY KEY,
                seq          BIGINT NOT NULL,
                operation_id VARCHAR(64) NOT NULL REFERENCES operations(id),
                destination  VARCHAR(32) NOT NULL,
                consumer     VARCHAR(32) NOT NULL,
                semantics    VARCHAR(32) NOT NULL,
                confident    BOOLEAN NOT NULL,
                reasoning    VARCHAR,
                rationale    VARCHAR,
                model        VARCHAR(255),
                created_at   TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_FEEDBACK_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_user_feedback_operation ON user_feedback (operation_id)";

    private static final String OPERATION_COLUMNS = """
            id, seq, user_request, user_id, destination, consumer, semantics, confident, reasoning,
            status, agent_id, created_at, updated_at""";

    private static final String INSERT_OPERATION_SQL = """
            INSERT INTO operations (%s)
            VALUES (?, ?, ?, ?, NULL, NULL, NULL, NULL, NULL, ?, NULL, ?, ?)
            """.formatted(OPERATION_COLUMNS);

    private static final String SELECT_OPERATION_SQL =
            "SELECT " + OPERATION_COLUMNS + " FROM operations WHERE id = ?";

    private static final String LOCK_OPERATION_SQL = SELECT_OPERATION_SQL + " FOR UPDATE";

    private static final String LIST_OPERATIONS_SQL =
            "SELECT " + OPERATION_COLUMNS + " FROM operations ORDER BY seq DESC LIMIT ?";

    private static final String COUNT_CLASSIFIED_SQL =
            "SELECT COUNT(*) FROM operations WHERE destination IS NOT NULL";

    private static final String COUNT_CLASSIFIED_FOR_USER_SQL =
            "SELECT COUNT(*) FROM operations WHERE destination IS NOT NULL AND user_id = ?";

    private static final String UPDATE_OPERATION_SQL = """
            UPDATE operations
            SET destination = ?, consumer = ?, semantics = ?, confident = ?, reasoning = ?,
                status = ?, agent_id = ?, updated_at = ?
            WHERE id = ? AND status = ?
            """;

    private static final String FEEDBACK_COLUMNS = """
            id, seq, operation_id, user_id, feedback_type,
            system_destination, system_consumer, system_semantics, system_confident, system_reasoning,
            corrected_destination, corrected_consumer, corrected_semantics, correction_reasoning, created_at""";

    private static final String INSERT_FEEDBACK_SQL = """
            INSERT INTO user_feedback (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(FEEDBACK_COLUMNS);

    private static final String LIST_FEEDBACK_SQL =
            "SELECT " + FEEDBACK_COLUMNS + " FROM user_feedback WHERE operation_id = ? ORDER BY seq ASC";

    private static final String LIST_ALL_FEEDBACK_SQL =
            "SELECT " + FEEDBACK_COLUMNS + " FROM user_feedback ORDER BY seq ASC";

    private static final String LIST_USER_FEEDBACK_SQL =
            "SELECT " + FEEDBACK_COLUMNS + " FROM user_feedback WHERE user_id = ? ORDER BY seq ASC";

    private static final String FIND_CORRECTIONS_SQL = """
            SELECT o.user_request, f.system_destination, f.system_consumer, f.system_semantics,
                   f.corrected_destination, f.corrected_consumer, f.corrected_semantics,
                   f.correction_reasoning, f.created_at
            FROM user_feedback f
            JOIN operations o ON o.id = f.operation_id
            WHERE f.feedback_type = 'correction'
              AND f.seq = (SELECT MAX(l.seq) FROM user_feedback l
                           WHERE l.operation_id = f.operation_id AND l.feedback_type = 'correction')
            ORDER BY f.seq DESC
            LIMIT ?
            """;

    private static final String HAS_CORRECTIONS_SQL =
            "SELECT 1 FROM user_feedback WHERE feedback_type = 'correction' LIMIT 1";

    private static final String INSERT_CLASSIFICATION_LOG_SQL = """
            INSERT INTO classification_log (id, seq, operation_id, destination, consumer, semantics,
                                            confident, reasoning, rationale, model, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String LIST_CLASSIFICATION_LOG_SQL = """
            SELECT operation_id, destination, consumer, semantics, confident, reasoning, rationale, model, created_at
            FROM classification_log
            WHERE operation_id = ?
            ORDER BY seq ASC
            """;

    private final DataSource dataSource;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public JdbcOperationStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the tables if they do not exist yet.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_OPERATIONS_SQL);
            stmt.execute(CREATE_FEEDBACK_SQL);
            stmt.execute(CREATE_CLASSIFICATION_LOG_SQL);
            stmt.execute(CREATE_FEEDBACK_INDEX_SQL);
            log.info("Operation store tables ensured");
        }
    }

    /**
     * Seeds the sequence from existing rows so recency survives restarts.
     */
    public void initialize() throws SQLException {
        long max = 0;
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String table : List.of("operations", "user_feedback", "classification_log")) {
                try (ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(seq), 0) FROM " + table)) {
                    if (rs.next()) {
                        max = Math.max(max, rs.getLong(1));
                    }
                }
            }
        }
        sequence.set(max);
        log.debug("Operation store sequence starts after {}", max);
    }

    @Override
    public AtomicOperation createOperation(String userRequest, String userId) {
        Objects.requireNonNull(userRequest, "userRequest");
        Instant now = now();
        var operation = new AtomicOperation(UUID.randomUUID().toString(), userRequest, userId,
                null, OperationStatus.CREATED, now, now, null);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_OPERATION_SQL)) {
            stmt.setString(1, operation.id());
            stmt.setLong(2, sequence.incrementAndGet());
            stmt.setString(3, userRequest);
            stmt.setString(4, userId);
            stmt.setString(5, operation.status().name());
            stmt.setTimestamp(6, Timestamp.from(now));
            stmt.setTimestamp(7, Timestamp.from(now));
            stmt.executeUpdate();
            return operation;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to create operation", e);
        }
    }

    @Override
    public Optional<AtomicOperation> findOperation(String operationId) {
        if (operationId == null) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection()) {
            return findOperation(conn, operationId);
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to load operation " + operationId, e);
        }
    }

    @Override
    public List<AtomicOperation> listOperations(int limit) {
        InMemoryOperationStore.requireLimit(limit);
        List<AtomicOperation> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LIST_OPERATIONS_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(operationFrom(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to list operations", e);
        }
    }

    @Override
    public int countClassifiedOperations(String userId) {
        String sql = userId == null ? COUNT_CLASSIFIED_SQL : COUNT_CLASSIFIED_FOR_USER_SQL;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (userId != null) {
                stmt.setString(1, userId);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to count operations", e);
        }
    }

    @Override
    public AtomicOperation updateClassification(String operationId, Classification classification) {
        Objects.requireNonNull(classification, "classification");
        return update(operationId, OperationStatus.CLASSIFIED, op -> op.withClassification(classification, now()));
    }

    @Override
    public AtomicOperation assignAgent(String operationId, String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return update(operationId, OperationStatus.ROUTED, op -> op.withAgent(agentId, now()));
    }

    @Override
    public AtomicOperation transition(String operationId, OperationStatus target) {
        return update(operationId, target, op -> op.withStatus(target, now()));
    }

    @Override
    public UserFeedback appendFeedback(UserFeedback feedback) {
        try (Connection conn = dataSource.getConnection()) {
            if (findOperation(conn, feedback.operationId()).isEmpty()) {
                throw new OperationNotFoundException(feedback.operationId());
            }
            insertFeedback(conn, feedback);
            return feedback;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to store feedback for operation " + feedback.operationId(), e);
        }
    }

    /**
     * Locks the operation row, inserts the correction and reclassifies in one
     * transaction, so concurrent corrections commit in the order their
     * feedback rows are numbered.
     */
    @Override
    public AtomicOperation applyCorrection(UserFeedback correction) {
        InMemoryOperationStore.requireCorrection(correction);
        String operationId = correction.operationId();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                AtomicOperation current = lockOperation(conn, operationId)
                        .orElseThrow(() -> new OperationNotFoundException(operationId));
                insertFeedback(conn, correction);
                AtomicOperation result = current;
                if (!current.status().isTerminal()) {
                    OperationStateMachine.requireTransition(operationId, current.status(), OperationStatus.CLASSIFIED);
                    result = current.withClassification(correction.correctedClassification(), now());
                    if (!compareAndSet(conn, current.status(), result)) {
                        throw new OperationStoreException("Operation " + operationId + " changed while locked", null);
                    }
                }
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to apply correction to operation " + operationId, e);
        }
    }

    @Override
    public List<UserFeedback> listFeedback(String operationId) {
        return queryFeedback(LIST_FEEDBACK_SQL, operationId);
    }

    @Override
    public List<UserFeedback> listAllFeedback(String userId) {
        return userId == null ? queryFeedback(LIST_ALL_FEEDBACK_SQL, null) : queryFeedback(LIST_USER_FEEDBACK_SQL, userId);
    }

    @Override
    public List<CorrectionExemplar> findCorrections(int limit) {
        InMemoryOperationStore.requireLimit(limit);
        if (limit == 0) {
            return List.of();
        }
        List<CorrectionExemplar> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(FIND_CORRECTIONS_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new CorrectionExemplar(
                            rs.getString("user_request"),
                            rs.getString("system_destination"),
                            rs.getString("system_consumer"),
                            rs.getString("system_semantics"),
                            rs.getString("corrected_destination"),
                            rs.getString("corrected_consumer"),
                            rs.getString("corrected_semantics"),
                            rs.getString("correction_reasoning"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to load corrections", e);
        }
    }

    @Override
    public boolean hasCorrections() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(HAS_CORRECTIONS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to check corrections", e);
        }
    }

    @Override
    public void logClassification(String operationId, ClassificationResult result) {
        Classification c = result.classification();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_CLASSIFICATION_LOG_SQL)) {
            stmt.setString(1, UUID.randomUUID().toString());
            stmt.setLong(2, sequence.incrementAndGet());
            stmt.setString(3, operationId);
            stmt.setString(4, c.destination().value());
            stmt.setString(5, c.consumer().value());
            stmt.setString(6, c.semantics().value());
            stmt.setBoolean(7, c.confident());
            stmt.setString(8, c.reasoning());
            stmt.setString(9, result.rationale());
            stmt.setString(10, result.model());
            stmt.setTimestamp(11, Timestamp.from(now()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to log classification for operation " + operationId, e);
        }
    }

    @Override
    public List<ClassificationLogEntry> listClassificationLog(String operationId) {
        List<ClassificationLogEntry> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LIST_CLASSIFICATION_LOG_SQL)) {
            stmt.setString(1, operationId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    var classification = new Classification(
                            DestinationType.fromValue(rs.getString("destination")),
                            ConsumerType.fromValue(rs.getString("consumer")),
                            ExecutionSemantics.fromValue(rs.getString("semantics")),
                            rs.getBoolean("confident"),
                            rs.getString("reasoning"));
                    result.add(new ClassificationLogEntry(rs.getString("operation_id"), classification,
                            rs.getString("rationale"), rs.getString("model"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to load classification log for " + operationId, e);
        }
    }

    // ── Internals ────────────────────────────────────────────────────

    private AtomicOperation update(String operationId, OperationStatus target, UnaryOperator<AtomicOperation> change) {
        try (Connection conn = dataSource.getConnection()) {
            for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
                AtomicOperation current = findOperation(conn, operationId)
                        .orElseThrow(() -> new OperationNotFoundException(operationId));
                OperationStateMachine.requireTransition(operationId, current.status(), target);
                AtomicOperation updated = change.apply(current);
                if (compareAndSet(conn, current.status(), updated)) {
                    return updated;
                }
                log.debug("Concurrent update on operation {} (attempt {}), re-reading", operationId, attempt);
            }
            throw new OperationStoreException("Operation " + operationId + " kept changing concurrently", null);
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to update operation " + operationId, e);
        }
    }

    private boolean compareAndSet(Connection conn, OperationStatus expected, AtomicOperation updated) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_OPERATION_SQL)) {
            Classification c = updated.classification();
            stmt.setString(1, c != null ? c.destination().value() : null);
            stmt.setString(2, c != null ? c.consumer().value() : null);
            stmt.setString(3, c != null ? c.semantics().value() : null);
            if (c != null) {
                stmt.setBoolean(4, c.confident());
            } else {
                stmt.setNull(4, Types.BOOLEAN);
            }
            stmt.setString(5, c != null ? c.reasoning() : null);
            stmt.setString(6, updated.status().name());
            stmt.setString(7, updated.agentId());
            stmt.setTimestamp(8, Timestamp.from(updated.updatedAt()));
            stmt.setString(9, updated.id());
            stmt.setString(10, expected.name());
            return stmt.executeUpdate() == 1;
        }
    }

    private void insertFeedback(Connection conn, UserFeedback feedback) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_FEEDBACK_SQL)) {
            Classification system = feedback.systemClassification();
            stmt.setString(1, feedback.id());
            stmt.setLong(2, sequence.incrementAndGet());
            stmt.setString(3, feedback.operationId());
            stmt.setString(4, feedback.userId());
            stmt.setString(5, feedback.feedbackType().value());
            stmt.setString(6, system != null ? system.destination().value() : null);
            stmt.setString(7, system != null ? system.consumer().value() : null);
            stmt.setString(8, system != null ? system.semantics().value() : null);
            if (system != null) {
                stmt.setBoolean(9, system.confident());
            } else {
                stmt.setNull(9, Types.BOOLEAN);
            }
            stmt.setString(10, system != null ? system.reasoning() : null);
            stmt.setString(11, feedback.correctedDestination() != null ? feedback.correctedDestination().value() : null);
            stmt.setString(12, feedback.correctedConsumer() != null ? feedback.correctedConsumer().value() : null);
            stmt.setString(13, feedback.correctedSemantics() != null ? feedback.correctedSemantics().value() : null);
            stmt.setString(14, feedback.correctionReasoning());
            stmt.setTimestamp(15, Timestamp.from(feedback.createdAt()));
            stmt.executeUpdate();
        }
    }

    private Optional<AtomicOperation> lockOperation(Connection conn, String operationId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LOCK_OPERATION_SQL)) {
            stmt.setString(1, operationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(operationFrom(rs)) : Optional.empty();
            }
        }
    }

    private Optional<AtomicOperation> findOperation(Connection conn, String operationId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_OPERATION_SQL)) {
            stmt.setString(1, operationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(operationFrom(rs)) : Optional.empty();
            }
        }
    }

    private List<UserFeedback> queryFeedback(String sql, String parameter) {
        List<UserFeedback> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                stmt.setString(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(feedbackFrom(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new OperationStoreException("Failed to load feedback", e);
        }
    }

    private static AtomicOperation operationFrom(ResultSet rs) throws SQLException {
        Classification classification = null;
        String destination = rs.getString("destination");
        if (destination != null) {
            classification = new Classification(
                    DestinationType.fromValue(destination),
                    ConsumerType.fromValue(rs.getString("consumer")),
                    ExecutionSemantics.fromValue(rs.getString("semantics")),
                    rs.getBoolean("confident"),
                    rs.getString("reasoning"));
        }
        return new AtomicOperation(
                rs.getString("id"),
                rs.getString("user_request"),
                rs.getString("user_id"),
                classification,
                OperationStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                rs.getString("agent_id"));
    }

    private static UserFeedback feedbackFrom(ResultSet rs) throws SQLException {
        Classification system = null;
        String systemDestination = rs.getString("system_destination");
        if (systemDestination != null) {
            system = new Classification(
                    DestinationType.fromValue(systemDestination),
                    ConsumerType.fromValue(rs.getString("system_consumer")),
                    ExecutionSemantics.fromValue(rs.getString("system_semantics")),
                    rs.getBoolean("system_confident"),
                    rs.getString("system_reasoning"));
        }
        String correctedDestination = rs.getString("corrected_destination");
        String correctedConsumer = rs.getString("corrected_consumer");
        String correctedSemantics = rs.getString("corrected_semantics");
        return new UserFeedback(
                rs.getString("id"),
                rs.getString("operation_id"),
                rs.getString("user_id"),
                FeedbackType.fromValue(rs.getString("feedback_type")),
                system,
                correctedDestination != null ? DestinationType.fromValue(correctedDestination) : null,
                correctedConsumer != null ? ConsumerType.fromValue(correctedConsumer) : null,
                correctedSemantics != null ? ExecutionSemantics.fromValue(correctedSemantics) : null,
                rs.getString("correction_reasoning"),
                rs.getTimestamp("created_at").toInstant());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
