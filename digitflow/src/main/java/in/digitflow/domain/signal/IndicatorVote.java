package in.digitflow.domain.signal;

/**
 * One indicator's contribution to the vote.
 *
 * @param strength raw indicator strength before weighting
 * @param score    strength x learned weight x indicator factor, added to the side's tally
 * @param trace    short human-readable fragment, e.g. {@code MKV:7@42%}
 */
public record IndicatorVote(
    Indicator indicator,
    Side side,
    double strength,
    double score,
    String trace
) {}
