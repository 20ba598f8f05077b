package in.digitflow.infrastructure.venue;

import java.math.BigDecimal;

/**
 * Accepted {@code buy}: the venue's contract id and the prices it settled on.
 */
public record BuyReceipt(
    String contractId,
    String transactionId,
    BigDecimal buyPrice,
    BigDecimal payout
) {}
