package in.digitflow.infrastructure.persistence;

import in.digitflow.domain.session.Credential;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.RecoveryState;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.SessionType;
import in.digitflow.domain.session.StakingMode;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.security.TokenCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds the engine's session, participant and account records from raw bookkeeping rows.
 *
 * Two schema generations coexist in the store:
 * <pre>
 *   legacy                 current
 *   session_name           name
 *   session_type           type
 *   status 'active'        status 'running'
 *   volatility_index       markets (text[])
 *   initial_stake          base_stake
 *   minimum_balance        min_balance
 *   take_profit / tp       stop_loss / sl
 * </pre>
 * Every alias is resolved here so nothing past this class needs to know which one a row used.
 */
public final class SessionNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SessionNormalizer.class);

    private static final String DEFAULT_MARKET = "R_100";

    // ═══════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════

    public static TradingSession session(Map<String, Object> row) {
        String id = text(row, "id");
        if (id == null) {
            throw new IllegalArgumentException("Session row without id");
        }
        return new TradingSession(
            id,
            text(row, "name", "session_name"),
            SessionType.fromLabel(text(row, "type", "session_type")),
            SessionStatus.fromLabel(text(row, "status")),
            markets(row),
            StakingMode.fromLabel(text(row, "staking_mode")),
            decimal(row, "base_stake", "initial_stake", "current_stake"),
            percent(decimal(row, "stake_percent", "stake_percentage")),
            decimal(row, "martingale_multiplier"),
            decimal(row, "min_balance", "minimum_balance"),
            decimal(row, "default_tp", "take_profit"),
            decimal(row, "default_sl", "stop_loss"),
            decimal(row, "min_tp", "min_take_profit"),
            decimal(row, "min_sl", "min_stop_loss"),
            decimal(row, "loss_threshold", "max_loss"),
            decimal(row, "recovery_target", "target_amount"),
            instant(row, "started_at")
        );
    }

    static List<String> markets(Map<String, Object> row) {
        Object raw = first(row, "markets", "volatility_index", "market");
        List<String> markets = new ArrayList<>();
        if (raw instanceof Collection) {
            ((Collection<?>) raw).forEach(v -> addMarket(markets, String.valueOf(v)));
        } else if (raw instanceof Object[]) {
            Arrays.stream((Object[]) raw).forEach(v -> addMarket(markets, String.valueOf(v)));
        } else if (raw != null) {
            // Postgres array literal {R_100,R_50} or a comma list
            String literal = raw.toString().replace("{", "").replace("}", "").replace("\"", "");
            Arrays.stream(literal.split(",")).forEach(v -> addMarket(markets, v));
        }
        if (markets.isEmpty()) {
            markets.add(DEFAULT_MARKET);
        }
        return markets;
    }

    private static void addMarket(List<String> markets, String value) {
        if (value == null) return;
        String market = value.trim();
        if (!market.isEmpty() && !"null".equals(market) && !markets.contains(market)) {
            markets.add(market);
        }
    }

    /** Percentages stored as 2 mean 2 %. */
    private static BigDecimal percent(BigDecimal value) {
        if (value == null) return null;
        return value.compareTo(BigDecimal.ONE) > 0 ? value.movePointLeft(2) : value;
    }

    // ═══════════════════════════════════════════════════════════════
    // PARTICIPANT / ACCOUNT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Participant with effective TP/SL: its own values, else the session defaults.
     */
    public static Participant participant(Map<String, Object> row, TradingSession session, TradingAccount account) {
        BigDecimal tp = decimal(row, "take_profit", "tp");
        BigDecimal sl = decimal(row, "stop_loss", "sl");
        if (tp == null || tp.signum() == 0) {
            tp = session.defaultTakeProfit();
        }
        if (sl == null || sl.signum() == 0) {
            sl = session.defaultStopLoss();
        }
        String status = text(row, "status");
        return new Participant(
            text(row, "id"),
            session.id(),
            text(row, "user_id"),
            "accepted".equalsIgnoreCase(status) ? ParticipantStatus.ACTIVE : ParticipantStatus.fromLabel(status),
            tp,
            sl == null ? null : sl.abs(),
            account
        );
    }

    /**
     * Account with its decrypted credential. An unreadable token yields a null credential,
     * which the eligibility check reports as an invalid account.
     */
    public static TradingAccount account(Map<String, Object> row, TokenCipher cipher) {
        if (row == null) {
            return null;
        }
        String id = text(row, "id");
        Credential credential = null;
        String stored = text(row, "deriv_token", "api_token", "token");
        if (stored != null && !stored.isBlank()) {
            try {
                String token = cipher != null ? cipher.decrypt(stored) : plaintextOnly(stored);
                credential = token == null ? null : Credential.of(token);
            } catch (RuntimeException e) {
                log.warn("[SessionNormalizer] Token for account {} unreadable: {}", id, e.getMessage());
            }
        }
        Boolean active = bool(row, "is_active", "active");
        return new TradingAccount(
            id,
            text(row, "deriv_account_id", "account_id", "loginid"),
            credential,
            orZero(decimal(row, "balance")),
            textOr(row, "USD", "currency"),
            active == null || active
        );
    }

    private static String plaintextOnly(String stored) {
        if (stored.contains(":")) {
            log.warn("[SessionNormalizer] Encrypted token found but ENCRYPTION_KEY is not configured");
            return null;
        }
        return stored;
    }

    public static RecoveryState recoveryState(Map<String, Object> row) {
        Boolean active = bool(row, "is_active");
        return new RecoveryState(
            text(row, "session_id"),
            orValue(decimal(row, "current_multiplier", "multiplier"), BigDecimal.ONE),
            intValue(row, "consecutive_losses"),
            intValue(row, "max_consecutive_losses"),
            orZero(decimal(row, "recovered_amount")),
            orZero(decimal(row, "recovery_target", "target_amount")),
            active != null && !active
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // FIELD ACCESS
    // ═══════════════════════════════════════════════════════════════

    private static Object first(Map<String, Object> row, String... keys) {
        for (String key : keys) {
            Object v = row.get(key);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    static String text(Map<String, Object> row, String... keys) {
        Object v = first(row, keys);
        return v == null ? null : v.toString();
    }

    private static String textOr(Map<String, Object> row, String fallback, String... keys) {
        String v = text(row, keys);
        return v == null || v.isBlank() ? fallback : v;
    }

    static BigDecimal decimal(Map<String, Object> row, String... keys) {
        Object v = first(row, keys);
        if (v == null) return null;
        if (v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Number) return new BigDecimal(v.toString());
        try {
            return new BigDecimal(v.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean bool(Map<String, Object> row, String... keys) {
        Object v = first(row, keys);
        if (v == null) return null;
        if (v instanceof Boolean) return (Boolean) v;
        return Boolean.parseBoolean(v.toString());
    }

    private static int intValue(Map<String, Object> row, String key) {
        BigDecimal v = decimal(row, key);
        return v == null ? 0 : v.intValue();
    }

    private static Instant instant(Map<String, Object> row, String key) {
        Object v = row.get(key);
        if (v == null) return null;
        if (v instanceof Instant) return (Instant) v;
        if (v instanceof Timestamp) return ((Timestamp) v).toInstant();
        if (v instanceof OffsetDateTime) return ((OffsetDateTime) v).toInstant();
        try {
            return OffsetDateTime.parse(v.toString()).toInstant();
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static BigDecimal orZero(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }

    private static BigDecimal orValue(BigDecimal v, BigDecimal fallback) {
        return v == null ? fallback : v;
    }

    private SessionNormalizer() {}
}
