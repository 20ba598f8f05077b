package in.digitflow.infrastructure.persistence;

import in.digitflow.domain.repository.RecoveryStateRepository;
import in.digitflow.domain.session.RecoveryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class PostgresRecoveryStateRepository implements RecoveryStateRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRecoveryStateRepository.class);

    private final DataSource dataSource;

    public PostgresRecoveryStateRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<RecoveryState> find(String sessionId) {
        String sql = "SELECT * FROM recovery_states WHERE session_id::text = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(SessionNormalizer.recoveryState(JdbcRows.toMap(rs)));
                }
            }
        } catch (SQLException e) {
            log.error("Error loading recovery state for {}: {}", sessionId, e.getMessage(), e);
            throw new RuntimeException("Failed to load recovery state", e);
        }
        return Optional.empty();
    }

    @Override
    public void save(RecoveryState state) {
        String sql = """
            INSERT INTO recovery_states (
                session_id, recovery_target, recovered_amount, remaining_amount, recovery_progress,
                current_multiplier, consecutive_losses, max_consecutive_losses, is_active, completed_at
            ) VALUES (?::uuid, ?, ?, ?, ?, ?, ?, ?, ?, CASE WHEN ? THEN NOW() END)
            ON CONFLICT (session_id) DO UPDATE SET
                recovery_target = EXCLUDED.recovery_target,
                recovered_amount = EXCLUDED.recovered_amount,
                remaining_amount = EXCLUDED.remaining_amount,
                recovery_progress = EXCLUDED.recovery_progress,
                current_multiplier = EXCLUDED.current_multiplier,
                consecutive_losses = EXCLUDED.consecutive_losses,
                max_consecutive_losses = EXCLUDED.max_consecutive_losses,
                is_active = EXCLUDED.is_active,
                completed_at = COALESCE(recovery_states.completed_at, EXCLUDED.completed_at),
                updated_at = NOW()
            """;

        BigDecimal remaining = state.targetAmount().subtract(state.recoveredAmount()).max(BigDecimal.ZERO);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.sessionId());
            ps.setBigDecimal(2, state.targetAmount());
            ps.setBigDecimal(3, state.recoveredAmount());
            ps.setBigDecimal(4, remaining);
            ps.setBigDecimal(5, state.progressPercent());
            ps.setBigDecimal(6, state.multiplier());
            ps.setInt(7, state.consecutiveLosses());
            ps.setInt(8, state.maxConsecutiveLosses());
            ps.setBoolean(9, !state.completed());
            ps.setBoolean(10, state.completed());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Error saving recovery state for {}: {}", state.sessionId(), e.getMessage(), e);
            throw new RuntimeException("Failed to save recovery state", e);
        }
    }
}
