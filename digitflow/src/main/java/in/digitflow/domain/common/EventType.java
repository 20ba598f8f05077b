package in.digitflow.domain.common;

/**
 * Engine events forwarded to the notification sink.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // SIGNALS
    // ═══════════════════════════════════════════════════════════════
    SIGNAL_GENERATED,
    SIGNAL_VETOED,
    RISK_BLOCKED,

    // ═══════════════════════════════════════════════════════════════
    // TRADES
    // ═══════════════════════════════════════════════════════════════
    TRADE_OPENED,
    TRADE_CLOSED,
    TRADE_FAILED,
    ACCOUNT_INVALID,
    LOW_BALANCE,

    // ═══════════════════════════════════════════════════════════════
    // SESSION / SYSTEM
    // ═══════════════════════════════════════════════════════════════
    RECOVERY_COMPLETED,
    SESSION_REPORT,
    SAFETY_PAUSE,
    SAFETY_RESUMED,
    DRAWDOWN_GUARD,
    VENUE_UNAVAILABLE
}
