package in.digitflow.infrastructure.persistence;

import in.digitflow.domain.repository.SessionRepository;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.security.TokenCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of SessionRepository.
 *
 * Sessions are looked up in {@code trading_sessions} first and {@code trading_sessions_v2}
 * second; rows from either are normalized by {@link SessionNormalizer}.
 */
public final class PostgresSessionRepository implements SessionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSessionRepository.class);

    private static final List<String> SESSION_TABLES = List.of("trading_sessions", "trading_sessions_v2");

    private final DataSource dataSource;
    private final TokenCipher cipher;

    public PostgresSessionRepository(DataSource dataSource, TokenCipher cipher) {
        this.dataSource = dataSource;
        this.cipher = cipher;
    }

    @Override
    public Optional<TradingSession> findSession(String sessionId) {
        for (String table : SESSION_TABLES) {
            String sql = "SELECT * FROM " + table + " WHERE id::text = ?";
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return Optional.of(SessionNormalizer.session(JdbcRows.toMap(rs)));
                    }
                }
            } catch (SQLException e) {
                // The older table may not exist in every deployment
                log.debug("Session lookup in {} failed: {}", table, e.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Participant> findActiveParticipants(String sessionId) {
        TradingSession session = findSession(sessionId)
            .orElseThrow(() -> new IllegalStateException("Session not found: " + sessionId));

        String sql = """
            SELECT * FROM session_participants
            WHERE session_id::text = ?
              AND status IN ('active', 'accepted')
            ORDER BY accepted_at ASC
            """;

        List<Participant> participants = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> row = JdbcRows.toMap(rs);
                    TradingAccount account = findAccount(conn, row);
                    participants.add(SessionNormalizer.participant(row, session, account));
                }
            }
        } catch (SQLException e) {
            log.error("Error loading participants for session {}: {}", sessionId, e.getMessage(), e);
            throw new RuntimeException("Failed to load participants", e);
        }
        return participants;
    }

    /**
     * The account bound to the participant row, else the user's most recently updated active account.
     */
    private TradingAccount findAccount(Connection conn, Map<String, Object> participant) throws SQLException {
        String accountId = SessionNormalizer.text(participant, "account_id");
        String sql;
        String key;
        if (accountId != null) {
            sql = "SELECT * FROM trading_accounts WHERE id::text = ?";
            key = accountId;
        } else {
            sql = """
                SELECT * FROM trading_accounts
                WHERE user_id::text = ? AND is_active = TRUE
                ORDER BY updated_at DESC
                LIMIT 1
                """;
            key = SessionNormalizer.text(participant, "user_id");
        }

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? SessionNormalizer.account(JdbcRows.toMap(rs), cipher) : null;
            }
        }
    }

    @Override
    public BigDecimal realizedProfitSince(String sessionId, Instant since) {
        String sql = """
            SELECT COALESCE(SUM(profit), 0) AS pnl
            FROM trades
            WHERE session_id::text = ?
              AND closed_at IS NOT NULL
              AND closed_at >= ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            ps.setTimestamp(2, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                BigDecimal pnl = rs.getBigDecimal("pnl");
                return pnl == null ? BigDecimal.ZERO : pnl;
            }
        } catch (SQLException e) {
            log.error("Error reading realized P&L for session {}: {}", sessionId, e.getMessage(), e);
            throw new RuntimeException("Failed to read realized P&L", e);
        }
    }

    @Override
    public void updateParticipantStatus(String participantId, ParticipantStatus status) {
        String sql = """
            UPDATE session_participants
            SET status = ?, removed_at = NOW(), removal_reason = ?
            WHERE id::text = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.label());
            ps.setString(2, status.label());
            ps.setString(3, participantId);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Error updating participant {}: {}", participantId, e.getMessage(), e);
            throw new RuntimeException("Failed to update participant status", e);
        }
    }

    @Override
    public void updateSessionStatus(String sessionId, SessionStatus status) {
        boolean ended = status == SessionStatus.COMPLETED || status == SessionStatus.CANCELLED;
        for (String table : SESSION_TABLES) {
            String sql = "UPDATE " + table + " SET status = ?, updated_at = NOW()"
                + (ended ? ", ended_at = NOW()" : "")
                + " WHERE id::text = ?";
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, status.label());
                ps.setString(2, sessionId);
                if (ps.executeUpdate() > 0) {
                    log.info("Session {} -> {}", sessionId, status.label());
                    return;
                }
            } catch (SQLException e) {
                log.debug("Session status update in {} failed: {}", table, e.getMessage());
            }
        }
        log.warn("Session {} not found for status update to {}", sessionId, status.label());
    }
}
