package in.digitflow.domain.session;

import java.math.BigDecimal;

/**
 * Venue account linked to a participant. Credential is null when the stored token is missing or unreadable.
 */
public record TradingAccount(
    String id,
    String venueAccountId,     // e.g. CR1234567
    Credential credential,
    BigDecimal balance,
    String currency,
    boolean active
) {}
