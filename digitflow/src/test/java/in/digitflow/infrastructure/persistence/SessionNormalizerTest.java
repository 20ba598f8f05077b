package in.digitflow.infrastructure.persistence;

import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.RecoveryState;
import in.digitflow.domain.session.SessionStatus;
import in.digitflow.domain.session.SessionType;
import in.digitflow.domain.session.StakingMode;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.security.TokenCipher;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SessionNormalizer.
 *
 * Tests:
 * - Legacy and current column names resolve to the same session
 * - Market lists from arrays, literals and defaults
 * - Participant TP/SL fall back to the session
 * - Account tokens: encrypted, plaintext, unreadable
 */
class SessionNormalizerTest {

    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private static Map<String, Object> legacySession() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", "s1");
        row.put("session_name", "Morning digits");
        row.put("session_type", "recovery");
        row.put("status", "active");
        row.put("volatility_index", "R_100");
        row.put("staking_mode", "martingale");
        row.put("initial_stake", "1.50");
        row.put("stake_percentage", new BigDecimal("2"));
        row.put("minimum_balance", 10);
        row.put("take_profit", new BigDecimal("10"));
        row.put("stop_loss", new BigDecimal("5"));
        row.put("started_at", Timestamp.from(Instant.parse("2026-04-10T08:00:00Z")));
        return row;
    }

    @Test
    void testLegacySessionRow() {
        TradingSession session = SessionNormalizer.session(legacySession());

        assertEquals("s1", session.id());
        assertEquals("Morning digits", session.name());
        assertEquals(SessionType.RECOVERY, session.type());
        assertEquals(SessionStatus.RUNNING, session.status(), "'active' is a running session");
        assertEquals(List.of("R_100"), session.markets());
        assertEquals(StakingMode.MARTINGALE, session.stakingMode());
        assertEquals(0, new BigDecimal("1.50").compareTo(session.baseStake()));
        assertEquals(0, new BigDecimal("0.02").compareTo(session.stakePercent()), "2 means 2 percent");
        assertEquals(0, BigDecimal.TEN.compareTo(session.minBalance()));
        assertEquals(Instant.parse("2026-04-10T08:00:00Z"), session.startedAt());
    }

    @Test
    void testCurrentSessionRow() {
        Map<String, Object> row = new HashMap<>();
        row.put("id", "s2");
        row.put("name", "Evening");
        row.put("type", "day");
        row.put("status", "running");
        row.put("markets", new String[] {"R_50", "R_100", "R_50"});
        row.put("base_stake", new BigDecimal("2"));
        row.put("stake_percent", new BigDecimal("0.05"));
        row.put("started_at", "2026-04-10T09:30:00Z");

        TradingSession session = SessionNormalizer.session(row);

        assertEquals(SessionType.DAY, session.type());
        assertEquals(List.of("R_50", "R_100"), session.markets(), "Duplicates dropped, order kept");
        assertEquals(StakingMode.FIXED, session.stakingMode());
        assertEquals(0, new BigDecimal("0.05").compareTo(session.stakePercent()));
        assertEquals(Instant.parse("2026-04-10T09:30:00Z"), session.startedAt());
    }

    @Test
    void testMarketsFromLiteralAndDefault() {
        assertEquals(List.of("R_10", "R_25"), SessionNormalizer.markets(Map.of("markets", "{R_10,\"R_25\"}")));
        assertEquals(List.of("R_75"), SessionNormalizer.markets(Map.of("markets", List.of("R_75", " "))));
        assertEquals(List.of("R_100"), SessionNormalizer.markets(Map.of()));
    }

    @Test
    void testSessionWithoutId() {
        assertThrows(IllegalArgumentException.class, () -> SessionNormalizer.session(Map.of("name", "x")));
    }

    @Test
    void testParticipantFallsBackToSessionDefaults() {
        TradingSession session = SessionNormalizer.session(legacySession());
        Map<String, Object> row = new HashMap<>();
        row.put("id", "p1");
        row.put("user_id", "u1");
        row.put("status", "accepted");
        row.put("take_profit", BigDecimal.ZERO);
        row.put("stop_loss", new BigDecimal("-4"));

        Participant participant = SessionNormalizer.participant(row, session, null);

        assertEquals("s1", participant.sessionId());
        assertEquals(ParticipantStatus.ACTIVE, participant.status());
        assertEquals(0, BigDecimal.TEN.compareTo(participant.takeProfit()), "Zero TP uses the session default");
        assertEquals(0, new BigDecimal("4").compareTo(participant.stopLoss()), "SL stored as a magnitude");
    }

    @Test
    void testAccountWithEncryptedToken() {
        TokenCipher cipher = TokenCipher.fromHexKey(KEY);
        Map<String, Object> row = new HashMap<>();
        row.put("id", "a1");
        row.put("deriv_account_id", "CR100");
        row.put("deriv_token", cipher.encrypt("real-token"));
        row.put("balance", new BigDecimal("250.00"));

        TradingAccount account = SessionNormalizer.account(row, cipher);

        assertEquals("CR100", account.venueAccountId());
        assertEquals("real-token", account.credential().token());
        assertEquals("USD", account.currency());
        assertTrue(account.active());
    }

    @Test
    void testAccountTokenUnreadable() {
        String stored = TokenCipher.fromHexKey(KEY).encrypt("real-token");
        Map<String, Object> row = new HashMap<>();
        row.put("id", "a1");
        row.put("deriv_token", stored);
        row.put("is_active", false);

        assertNull(SessionNormalizer.account(row, null).credential(), "Encrypted token without a key");
        TokenCipher otherKey = TokenCipher.fromHexKey(KEY.replace('0', 'f'));
        TradingAccount account = SessionNormalizer.account(row, otherKey);
        assertNull(account.credential(), "Decryption failure");
        assertFalse(account.active());
        assertEquals(0, BigDecimal.ZERO.compareTo(account.balance()));
    }

    @Test
    void testAccountPlaintextToken() {
        TradingAccount account = SessionNormalizer.account(Map.of("id", "a2", "api_token", "plain"), null);

        assertEquals("plain", account.credential().token());
        assertTrue(account.credential().ref().startsWith("cred-"));
    }

    @Test
    void testRecoveryState() {
        Map<String, Object> row = new HashMap<>();
        row.put("session_id", "s1");
        row.put("current_multiplier", new BigDecimal("4"));
        row.put("consecutive_losses", 2);
        row.put("recovered_amount", new BigDecimal("3"));
        row.put("target_amount", new BigDecimal("12"));
        row.put("is_active", true);

        RecoveryState state = SessionNormalizer.recoveryState(row);

        assertEquals(0, new BigDecimal("4").compareTo(state.multiplier()));
        assertEquals(2, state.consecutiveLosses());
        assertFalse(state.completed());
        assertEquals(0, new BigDecimal("25").compareTo(state.progressPercent()));
    }
}
