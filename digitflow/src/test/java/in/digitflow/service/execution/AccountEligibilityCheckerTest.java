package in.digitflow.service.execution;

import in.digitflow.config.ExecutionConfig;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.ParticipantStatus;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import in.digitflow.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AccountEligibilityChecker.
 *
 * Tests:
 * - Eligible participant passes
 * - Missing account, credential, balance and TP/SL each rejected with their reason
 * - Admin minimums from the session, else engine floors
 */
class AccountEligibilityCheckerTest {

    private final AccountEligibilityChecker checker = new AccountEligibilityChecker(ExecutionConfig.defaults());
    private final TradingSession session = Fixtures.session("s1");

    private static Participant withTpSl(Participant p, String tp, String sl) {
        return new Participant(p.id(), p.sessionId(), p.userId(), ParticipantStatus.ACTIVE,
            tp == null ? null : new BigDecimal(tp), sl == null ? null : new BigDecimal(sl), p.account());
    }

    @Test
    void testSplitsEligibleAndInvalid() {
        Participant good = Fixtures.participant("p1", "s1", Fixtures.account("a1", "tok-1", new BigDecimal("100")));
        Participant broke = Fixtures.participant("p2", "s1", Fixtures.account("a2", "tok-2", new BigDecimal("9.99")));

        AccountEligibilityChecker.Result result = checker.check(session, List.of(good, broke));

        assertEquals(List.of(good), result.eligible());
        assertEquals(1, result.invalid().size());
        InvalidAccount invalid = result.invalid().get(0);
        assertEquals(InvalidAccount.Reason.LOW_BALANCE, invalid.reason());
        assertEquals("a2", invalid.accountId());
        assertTrue(invalid.detail().contains("$9.99 < $10.00"), invalid.detail());
    }

    @Test
    void testNoAccount() {
        Participant p = Fixtures.participant("p1", "s1", null);

        InvalidAccount invalid = checker.validate(session, p);

        assertEquals(InvalidAccount.Reason.NO_ACCOUNT, invalid.reason());
        assertNull(invalid.accountId());
    }

    @Test
    void testInactiveAccount() {
        TradingAccount inactive = new TradingAccount("a1", "CR1", null, new BigDecimal("100"), "USD", false);

        InvalidAccount invalid = checker.validate(session, Fixtures.participant("p1", "s1", inactive));

        assertEquals(InvalidAccount.Reason.NO_ACCOUNT, invalid.reason());
    }

    @Test
    void testMissingCredential() {
        Participant p = Fixtures.participant("p1", "s1", Fixtures.account("a1", null, new BigDecimal("100")));

        assertEquals(InvalidAccount.Reason.NO_CREDENTIAL, checker.validate(session, p).reason());
    }

    @Test
    void testMissingTpSl() {
        Participant base = Fixtures.participant("p1", "s1", Fixtures.account("a1", "tok", new BigDecimal("100")));

        assertEquals(InvalidAccount.Reason.TPSL_MISSING, checker.validate(session, withTpSl(base, null, "5")).reason());
        assertEquals(InvalidAccount.Reason.TPSL_MISSING, checker.validate(session, withTpSl(base, "10", "0")).reason());
    }

    @Test
    void testEngineFloors() {
        Participant base = Fixtures.participant("p1", "s1", Fixtures.account("a1", "tok", new BigDecimal("100")));

        assertEquals(InvalidAccount.Reason.TPSL_BELOW_MINIMUM,
            checker.validate(session, withTpSl(base, "4.99", "5")).reason(), "TP floor 5");
        assertEquals(InvalidAccount.Reason.TPSL_BELOW_MINIMUM,
            checker.validate(session, withTpSl(base, "10", "2")).reason(), "SL floor 3");
        assertNull(checker.validate(session, withTpSl(base, "5", "-3")), "Negative SL is compared by magnitude");
    }

    @Test
    void testSessionFloorsOverrideEngine() {
        TradingSession strict = new TradingSession("s1", "Strict", session.type(), session.status(), session.markets(),
            session.stakingMode(), session.baseStake(), null, null, session.minBalance(),
            session.defaultTakeProfit(), session.defaultStopLoss(), new BigDecimal("20"), new BigDecimal("8"),
            null, null, session.startedAt());
        Participant base = Fixtures.participant("p1", "s1", Fixtures.account("a1", "tok", new BigDecimal("100")));

        assertEquals(InvalidAccount.Reason.TPSL_BELOW_MINIMUM, checker.validate(strict, base).reason());
        assertNull(checker.validate(strict, withTpSl(base, "20", "8")));
    }
}
