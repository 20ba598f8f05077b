package in.digitflow.infrastructure.venue;

import java.math.BigDecimal;

/**
 * One {@code proposal_open_contract} update.
 */
public record ContractUpdate(
    String contractId,
    BigDecimal profit,
    boolean sold,
    String status,          // open | won | lost | sold
    BigDecimal buyPrice,
    BigDecimal payout,
    BigDecimal entrySpot,
    BigDecimal exitSpot
) {}
