package in.digitflow.domain.data;

import java.math.BigDecimal;

/**
 * A single price tick for a synthetic market.
 * The digit is the last base-10 digit of the quote once the decimal point is removed.
 */
public record Tick(
    String market,
    BigDecimal quote,
    long epoch,
    int digit
) {
    public static Tick of(String market, BigDecimal quote, long epoch) {
        return new Tick(market, quote, epoch, digitOf(quote));
    }

    /**
     * Last digit of the quote's canonical text. Trailing zeros are not significant:
     * the venue sends plain JSON numbers, so 1234.50 and 1234.5 are the same quote.
     */
    public static int digitOf(BigDecimal quote) {
        if (quote == null) {
            throw new IllegalArgumentException("quote is required");
        }
        String text = quote.abs().stripTrailingZeros().toPlainString().replace(".", "");
        char last = text.charAt(text.length() - 1);
        return last - '0';
    }
}
