package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.data.TickHistory;
import in.digitflow.domain.signal.DecisionLog;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Side;
import in.digitflow.domain.signal.Signal;
import in.digitflow.domain.signal.SignalDecision;
import in.digitflow.domain.signal.SignalDecision.Rejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Digit signal engine.
 *
 * Pipeline per evaluation:
 * 1. Warmup gate on the number of observed digits
 * 2. Entropy over the recent window classifies the regime (chaos = no trade)
 * 3. Markov, exhaustion, streak, bias and Bayesian indicators vote with learned weights
 * 4. Near-even votes are a contradiction
 * 5. Confidence and factor-count gates, then barrier digit selection
 *
 * No I/O and no shared state: the same history and weights always give the same decision
 * (only {@code generatedAt} depends on the clock).
 */
public final class SignalEngine {
    private static final Logger log = LoggerFactory.getLogger(SignalEngine.class);

    private final SignalConfig config;
    private final Clock clock;
    private final RegimeClassifier regimes;
    private final MarkovPredictor markov;
    private final ExhaustionDetector exhaustion;
    private final StreakDetector streak;
    private final BiasDetector bias;
    private final BayesianDigitPredictor bayesian;
    private final DigitSelector selector;

    public SignalEngine(SignalConfig config, Clock clock) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid signal configuration: " + config);
        }
        this.config = config;
        this.clock = clock;
        this.regimes = new RegimeClassifier(config);
        this.markov = new MarkovPredictor(config);
        this.exhaustion = new ExhaustionDetector(config);
        this.streak = new StreakDetector(config);
        this.bias = new BiasDetector(config);
        this.bayesian = new BayesianDigitPredictor(config);
        this.selector = new DigitSelector(config.posteriorWeight());
    }

    public SignalDecision evaluate(TickHistory history, IndicatorWeights weights) {
        String market = history.market();
        List<Integer> digits = history.digits();

        // 1. Warmup
        if (digits.size() < config.warmupDigits()) {
            return SignalDecision.reject(market, Rejection.WARMUP,
                "warmup " + digits.size() + "/" + config.warmupDigits(), null, DecisionLog.warmup(digits.size()));
        }

        // 2. Entropy & regime
        double entropy = EntropyCalculator.entropy(DigitStatistics.tail(digits, config.entropyWindow()));
        Regime regime = regimes.classify(entropy);
        if (regime == Regime.CHAOS) {
            String trace = header(entropy, regime) + " | CHAOS";
            DecisionLog chaosLog = new DecisionLog(digits.size(), entropy, regime, 0, 0, 0, 0, null, 0,
                regimes.requiredConfidence(regime), null, 0, List.of(), false, false, trace);
            return SignalDecision.reject(market, Rejection.CHAOS,
                String.format("entropy %.3f >= %.2f", entropy, config.chaosEntropy()), regime, chaosLog);
        }

        // 3. Indicators
        double[] posterior = bayesian.posterior(digits);
        double[] frequency = DigitStatistics.frequencies(DigitStatistics.tail(digits, config.bayesianPriorWindow()));
        List<IndicatorVote> votes = new ArrayList<>(5);
        markov.vote(digits, weights).ifPresent(votes::add);
        exhaustion.vote(digits, weights).ifPresent(votes::add);
        streak.vote(digits, weights).ifPresent(votes::add);
        bias.vote(digits, weights).ifPresent(votes::add);
        bayesian.vote(posterior, weights).ifPresent(votes::add);

        return decide(market, digits.size(), entropy, regime, votes, posterior, frequency);
    }

    /**
     * Vote, contradiction check, gates and digit selection over already computed votes.
     */
    SignalDecision decide(String market, int digitsObserved, double entropy, Regime regime,
                          List<IndicatorVote> votes, double[] posterior, double[] frequency) {
        double over = 0.0;
        double under = 0.0;
        for (IndicatorVote vote : votes) {
            if (vote.side() == Side.OVER) {
                over += vote.score();
            } else {
                under += vote.score();
            }
        }
        double total = over + under;
        double voteRatio = total > 0 ? Math.abs(over - under) / total : 0.0;
        Side side = total > 0 ? (over >= under ? Side.OVER : Side.UNDER) : null;
        double confidence = Math.min(voteRatio, 1.0);
        double required = regimes.requiredConfidence(regime);
        boolean meetsConfidence = confidence >= required;
        boolean meetsFactors = votes.size() >= config.minFactors();

        String factors = votes.stream().map(IndicatorVote::trace).collect(Collectors.joining(" "));
        String base = header(entropy, regime) + " | " + (factors.isEmpty() ? "no factors" : factors);

        if (total > 0 && voteRatio < config.contradictionRatio() && votes.size() >= config.minFactors()) {
            String trace = base + String.format(" | CONTRADICTION %.2f", voteRatio);
            DecisionLog contradiction = new DecisionLog(digitsObserved, entropy, regime, over, under, total,
                voteRatio, side, confidence, required, null, 0, votes, meetsConfidence, meetsFactors, trace);
            log.debug("[SignalEngine] {} contradiction: {}", market, trace);
            return SignalDecision.reject(market, Rejection.CONTRADICTION,
                String.format("vote ratio %.3f below %.2f", voteRatio, config.contradictionRatio()), regime, contradiction);
        }

        if (!meetsConfidence || !meetsFactors || side == null) {
            Rejection rejection = !meetsFactors || side == null ? Rejection.INSUFFICIENT_FACTORS : Rejection.LOW_CONFIDENCE;
            String reason = rejection == Rejection.LOW_CONFIDENCE
                ? String.format("confidence %.3f below %.2f (%s)", confidence, required, regime.label())
                : votes.size() + " of " + config.minFactors() + " factors";
            DecisionLog rejected = new DecisionLog(digitsObserved, entropy, regime, over, under, total, voteRatio,
                side, confidence, required, null, 0, votes, meetsConfidence, meetsFactors, base + " | " + rejection);
            return SignalDecision.reject(market, rejection, reason, regime, rejected);
        }

        // 5. Digit selection
        DigitSelector.Selection selection = selector.select(side, posterior, frequency);
        String trace = base + String.format(" | %s %d (%s)", side, selection.digit(), DigitStatistics.percent(confidence));
        DecisionLog decision = new DecisionLog(digitsObserved, entropy, regime, over, under, total, voteRatio,
            side, confidence, required, selection.digit(), selection.score(), votes, true, true, trace);

        Set<Indicator> indicators = EnumSet.noneOf(Indicator.class);
        votes.forEach(v -> indicators.add(v.indicator()));
        Signal signal = new Signal(market, side, selection.digit(), confidence, regime, indicators,
            clock.instant(), trace, decision);
        log.debug("[SignalEngine] {} signal: {}", market, trace);
        return SignalDecision.trade(signal);
    }

    private static String header(double entropy, Regime regime) {
        return String.format("H=%.2f %s", entropy, regime.label());
    }

    public SignalConfig config() {
        return config;
    }
}
