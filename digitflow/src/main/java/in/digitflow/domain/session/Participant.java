package in.digitflow.domain.session;

import java.math.BigDecimal;

/**
 * A user's membership in a session with their own exit thresholds.
 * TP/SL are null when neither the participant nor the session defines them.
 */
public record Participant(
    String id,
    String sessionId,
    String userId,
    ParticipantStatus status,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    TradingAccount account     // null when the user has no active account
) {}
