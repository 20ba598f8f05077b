package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorVote;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the individual indicators and the barrier digit selector.
 *
 * Tests:
 * - Markov successor counting, minimum observations
 * - Exhaustion of missing digits
 * - Streak direction, circular deltas, continuation vs reversion
 * - Bias follow vs fade
 * - Bayesian posterior normalization and vote
 * - Digit selection tie-break
 */
class IndicatorsTest {

    private final SignalConfig config = SignalConfig.defaults();
    private final IndicatorWeights weights = IndicatorWeights.defaults();

    private static List<Integer> repeat(List<Integer> block, int times) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            out.addAll(block);
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // Markov
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testSuccessorCountsOfLatestDigit() {
        int[] counts = MarkovPredictor.successorCounts(List.of(3, 5, 3, 5, 3), 50);

        assertEquals(2, counts[5], "3 was followed by 5 twice");
        assertEquals(0, counts[3]);
    }

    @Test
    void testMarkovNeedsMinimumObservations() {
        MarkovPredictor markov = new MarkovPredictor(config);

        assertTrue(markov.vote(List.of(3, 5, 3, 5, 3), weights).isEmpty(), "Two observations are not enough");
    }

    @Test
    void testMarkovVotesForDominantSuccessor() {
        List<Integer> digits = new ArrayList<>(repeat(List.of(3, 8), 6));
        digits.add(3);

        Optional<IndicatorVote> vote = new MarkovPredictor(config).vote(digits, weights);

        assertTrue(vote.isPresent());
        assertEquals(Indicator.MARKOV, vote.get().indicator());
        assertEquals(Side.OVER, vote.get().side(), "Predicted digit 8 is a high digit");
        assertEquals(1.0, vote.get().strength(), 1e-9);
        assertEquals("MKV:8@100%", vote.get().trace());
    }

    @Test
    void testTransitionRowNullWithoutSuccessor() {
        assertNull(MarkovPredictor.transitionRow(List.of(1, 2, 3), 50), "Digit 3 never appeared before the end");
    }

    // ═══════════════════════════════════════════════════════════════
    // Exhaustion
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testExhaustionPicksMissingDigit() {
        Optional<IndicatorVote> vote = new ExhaustionDetector(config).vote(repeat(List.of(0, 1, 2, 3, 4), 10), weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.OVER, vote.get().side(), "Lowest missing digit is 5");
        assertEquals("EXH:5", vote.get().trace());
        assertEquals(1.0 * ExhaustionDetector.FACTOR, vote.get().score(), 1e-9);
    }

    @Test
    void testExhaustionSilentOnUniformWindow() {
        List<Integer> uniform = repeat(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), 5);

        assertTrue(new ExhaustionDetector(config).vote(uniform, weights).isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════
    // Streak
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testCircularDelta() {
        assertEquals(1, StreakDetector.delta(9, 0, true), "9 -> 0 is one step up");
        assertEquals(-1, StreakDetector.delta(0, 9, true));
        assertEquals(-9, StreakDetector.delta(9, 0, false));
        assertEquals(3, StreakDetector.delta(2, 5, true));
    }

    @Test
    void testTrailingStreak() {
        assertEquals(3, StreakDetector.trailingStreak(List.of(5, 1, 2, 3, 4), false));
        assertEquals(-2, StreakDetector.trailingStreak(List.of(1, 9, 8, 7), false));
        assertEquals(0, StreakDetector.trailingStreak(List.of(4, 4), false), "A repeat ends the run");
        assertEquals(2, StreakDetector.trailingStreak(List.of(9, 0, 1), true));
        assertEquals(1, StreakDetector.trailingStreak(List.of(9, 0, 1), false));
    }

    @Test
    void testStreakContinuation() {
        Optional<IndicatorVote> vote = new StreakDetector(config).vote(List.of(7, 1, 2, 3, 4), weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.OVER, vote.get().side(), "Three rising steps continue upward");
        assertEquals(0.45, vote.get().strength(), 1e-9);
        assertEquals("STK:3→CONT", vote.get().trace());
    }

    @Test
    void testStreakReversion() {
        Optional<IndicatorVote> vote = new StreakDetector(config).vote(List.of(0, 1, 2, 3, 4), weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.UNDER, vote.get().side(), "Four rising steps suggest reversion");
        assertEquals(0.6, vote.get().strength(), 1e-9);
    }

    @Test
    void testShortStreakSilent() {
        assertTrue(new StreakDetector(config).vote(List.of(4, 4, 5, 6), weights).isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════
    // Bias
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testModerateBiasFollowsDominantSide() {
        List<Integer> digits = new ArrayList<>(Collections.nCopies(8, 7));
        digits.addAll(Collections.nCopies(5, 2));

        Optional<IndicatorVote> vote = new BiasDetector(config).vote(digits, weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.OVER, vote.get().side());
    }

    @Test
    void testStrongBiasFades() {
        List<Integer> digits = new ArrayList<>(Collections.nCopies(10, 7));
        digits.addAll(Collections.nCopies(5, 2));

        Optional<IndicatorVote> vote = new BiasDetector(config).vote(digits, weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.UNDER, vote.get().side(), "Imbalance above the reversion threshold fades");
        assertEquals("BIAS:UNDER", vote.get().trace());
    }

    @Test
    void testBalancedWindowSilent() {
        assertTrue(new BiasDetector(config).vote(List.of(1, 6, 2, 7, 3, 8), weights).isEmpty());
    }

    // ═══════════════════════════════════════════════════════════════
    // Bayesian
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testPosteriorIsNormalized() {
        double[] prior = {0.5, 0.5, 0, 0, 0, 0, 0, 0, 0, 0};
        double[] likelihood = {0, 1, 0, 0, 0, 0, 0, 0, 0, 0};

        double[] posterior = BayesianDigitPredictor.posterior(prior, likelihood);

        double sum = 0;
        for (double p : posterior) {
            assertTrue(p > 0, "Floors keep every digit possible");
            sum += p;
        }
        assertEquals(1.0, sum, 1e-9);
        assertEquals(1, DigitStatistics.argMax(posterior));
    }

    @Test
    void testMissingLikelihoodIsUniform() {
        double[] prior = new double[10];
        Arrays.fill(prior, 0.1);

        double[] posterior = BayesianDigitPredictor.posterior(prior, null);

        assertEquals(0.5, BayesianDigitPredictor.overProbability(posterior), 1e-9);
        assertTrue(new BayesianDigitPredictor(config).vote(posterior, weights).isEmpty(), "No edge, no vote");
    }

    @Test
    void testBayesianVotesForHeavySide() {
        double[] posterior = {0.02, 0.02, 0.02, 0.02, 0.02, 0.02, 0.02, 0.82, 0.02, 0.02};

        Optional<IndicatorVote> vote = new BayesianDigitPredictor(config).vote(posterior, weights);

        assertTrue(vote.isPresent());
        assertEquals(Side.OVER, vote.get().side());
        assertEquals(0.8, vote.get().strength(), 1e-9);
        assertEquals(0.8 * BayesianDigitPredictor.FACTOR, vote.get().score(), 1e-9);
    }

    // ═══════════════════════════════════════════════════════════════
    // Digit selection
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testSelectorTieGoesToLowerDigit() {
        double[] flat = new double[10];
        Arrays.fill(flat, 0.1);

        DigitSelector.Selection under = new DigitSelector(0.7).select(Side.UNDER, flat, flat);
        DigitSelector.Selection over = new DigitSelector(0.7).select(Side.OVER, flat, flat);

        assertEquals(0, under.digit());
        assertEquals(5, over.digit());
    }

    @Test
    void testSelectorPrefersRareDigitOnSide() {
        double[] posterior = new double[10];
        Arrays.fill(posterior, 0.1);
        double[] frequency = {0.1, 0.1, 0.0, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1};

        assertEquals(2, new DigitSelector(0.7).select(Side.UNDER, posterior, frequency).digit());
    }
}
