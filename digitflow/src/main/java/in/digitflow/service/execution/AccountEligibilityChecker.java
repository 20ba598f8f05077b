package in.digitflow.service.execution;

import in.digitflow.config.ExecutionConfig;
import in.digitflow.domain.session.Participant;
import in.digitflow.domain.session.TradingAccount;
import in.digitflow.domain.session.TradingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Account Eligibility.
 * Splits a session's participants into tradeable ones and invalid ones with a reason.
 * Checks run in order and the first failure is reported.
 */
public final class AccountEligibilityChecker {
    private static final Logger log = LoggerFactory.getLogger(AccountEligibilityChecker.class);

    public record Result(List<Participant> eligible, List<InvalidAccount> invalid) {
        public Result {
            eligible = List.copyOf(eligible);
            invalid = List.copyOf(invalid);
        }
    }

    private final ExecutionConfig config;

    public AccountEligibilityChecker(ExecutionConfig config) {
        this.config = config;
    }

    public Result check(TradingSession session, List<Participant> participants) {
        List<Participant> eligible = new ArrayList<>();
        List<InvalidAccount> invalid = new ArrayList<>();

        for (Participant participant : participants) {
            InvalidAccount failure = validate(session, participant);
            if (failure == null) {
                eligible.add(participant);
            } else {
                log.info("[Eligibility] Skipping participant {} of session {}: {}",
                    participant.id(), session.id(), failure.detail());
                invalid.add(failure);
            }
        }
        return new Result(eligible, invalid);
    }

    /**
     * @return null when the participant can trade
     */
    InvalidAccount validate(TradingSession session, Participant participant) {
        TradingAccount account = participant.account();

        // ═══════════════════════════════════════════════════════════════
        // 1. Account and credential
        // ═══════════════════════════════════════════════════════════════

        if (account == null || !account.active()) {
            return invalid(participant, InvalidAccount.Reason.NO_ACCOUNT, "No active trading account");
        }
        if (account.credential() == null) {
            return invalid(participant, InvalidAccount.Reason.NO_CREDENTIAL, "API token missing or unreadable");
        }

        // ═══════════════════════════════════════════════════════════════
        // 2. Balance
        // ═══════════════════════════════════════════════════════════════

        BigDecimal minBalance = session.minBalance() == null ? BigDecimal.ZERO : session.minBalance();
        BigDecimal balance = account.balance() == null ? BigDecimal.ZERO : account.balance();
        if (balance.compareTo(minBalance) < 0) {
            return invalid(participant, InvalidAccount.Reason.LOW_BALANCE,
                "Balance too low: $" + money(balance) + " < $" + money(minBalance));
        }

        // ═══════════════════════════════════════════════════════════════
        // 3. Exit thresholds
        // ═══════════════════════════════════════════════════════════════

        BigDecimal tp = participant.takeProfit();
        BigDecimal sl = participant.stopLoss();
        if (tp == null || sl == null || tp.signum() <= 0 || sl.signum() == 0) {
            return invalid(participant, InvalidAccount.Reason.TPSL_MISSING, "TP/SL not set");
        }

        BigDecimal minTp = floor(session.minTakeProfit(), config.minTakeProfit());
        BigDecimal minSl = floor(session.minStopLoss(), config.minStopLoss());
        if (tp.compareTo(minTp) < 0 || sl.abs().compareTo(minSl) < 0) {
            return invalid(participant, InvalidAccount.Reason.TPSL_BELOW_MINIMUM,
                "TP/SL below admin minimums (tp>=" + minTp.toPlainString() + ", sl>=" + minSl.toPlainString() + ")");
        }

        return null;
    }

    private static BigDecimal floor(BigDecimal sessionValue, BigDecimal fallback) {
        return sessionValue != null && sessionValue.signum() > 0 ? sessionValue : fallback;
    }

    private static InvalidAccount invalid(Participant participant, InvalidAccount.Reason reason, String detail) {
        String accountId = participant.account() == null ? null : participant.account().id();
        return new InvalidAccount(participant.id(), participant.userId(), accountId, reason, detail);
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
