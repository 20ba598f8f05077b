package in.digitflow.infrastructure.persistence;

import in.digitflow.domain.repository.TradeAuditRepository;
import in.digitflow.domain.trade.TradeExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;

/**
 * PostgreSQL implementation of TradeAuditRepository over the {@code trades} table.
 */
public final class PostgresTradeAuditRepository implements TradeAuditRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeAuditRepository.class);

    private final DataSource dataSource;

    public PostgresTradeAuditRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void recordOpened(TradeExecution trade) {
        String sql = """
            INSERT INTO trades (
                id, session_id, user_id, account_id, contract_id, contract_type, volatility_index,
                stake, payout, prediction, strategy_name, status, opened_at
            ) VALUES (?::uuid, ?::uuid, ?::uuid, ?::uuid, ?, ?, ?, ?, ?, ?, 'digitflow', 'open', ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trade.executionId());
            ps.setString(2, trade.sessionId());
            ps.setString(3, trade.userId());
            ps.setString(4, trade.accountId());
            ps.setString(5, trade.contractId());
            ps.setString(6, trade.side().contractType());
            ps.setString(7, trade.market());
            ps.setBigDecimal(8, trade.stake());
            ps.setBigDecimal(9, trade.payout());
            ps.setString(10, trade.side().name() + " " + trade.barrier());
            ps.setTimestamp(11, Timestamp.from(trade.openedAt()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Error recording opened trade {}: {}", trade.contractId(), e.getMessage(), e);
            throw new RuntimeException("Failed to record opened trade", e);
        }
    }

    @Override
    public void recordClosed(TradeExecution trade) {
        String sql = """
            UPDATE trades SET
                status = ?,
                result = ?,
                exit_reason = ?,
                profit = ?,
                entry_tick = ?,
                exit_tick = ?,
                duration_ms = ?,
                closed_at = ?
            WHERE contract_id = ?
            """;

        boolean won = trade.profit() != null && trade.profit().signum() > 0;
        Duration duration = trade.duration();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, won ? "won" : "lost");
            ps.setString(2, won ? "win" : "loss");
            ps.setString(3, trade.status().label());
            ps.setBigDecimal(4, trade.profit());
            ps.setBigDecimal(5, trade.entrySpot());
            ps.setBigDecimal(6, trade.exitSpot());
            if (duration != null) {
                ps.setLong(7, duration.toMillis());
            } else {
                ps.setNull(7, Types.BIGINT);
            }
            ps.setTimestamp(8, Timestamp.from(trade.closedAt()));
            ps.setString(9, trade.contractId());

            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.warn("No trade row for contract {} ({})", trade.contractId(), trade.status().label());
            }
        } catch (SQLException e) {
            log.error("Error recording closed trade {}: {}", trade.contractId(), e.getMessage(), e);
            throw new RuntimeException("Failed to record closed trade", e);
        }
    }

    @Override
    public void markRecoveryEligible(TradeExecution trade) {
        if (!trade.isLoss()) {
            return;
        }
        String sql = """
            INSERT INTO user_trading_settings (user_id, can_join_recovery, last_sl_hit_at, updated_at)
            VALUES (?::uuid, TRUE, ?, NOW())
            ON CONFLICT (user_id) DO UPDATE SET
                can_join_recovery = TRUE,
                last_sl_hit_at = EXCLUDED.last_sl_hit_at,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trade.userId());
            ps.setTimestamp(2, Timestamp.from(trade.closedAt()));
            ps.executeUpdate();
            log.info("User {} eligible for recovery after {} on {}", trade.userId(), trade.status().label(), trade.contractId());

        } catch (SQLException e) {
            log.error("Error marking recovery eligibility for {}: {}", trade.userId(), e.getMessage(), e);
            throw new RuntimeException("Failed to mark recovery eligibility", e);
        }
    }
}
