package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Regime;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EntropyCalculator and RegimeClassifier.
 *
 * Tests:
 * - Entropy bounds (single digit, uniform window)
 * - Two-digit split is one bit
 * - Regime thresholds and required confidence
 */
class EntropyCalculatorTest {

    private final RegimeClassifier classifier = new RegimeClassifier(SignalConfig.defaults());

    @Test
    void testSingleDigitHasZeroEntropy() {
        assertEquals(0.0, EntropyCalculator.entropy(List.of(4, 4, 4, 4, 4)), 1e-9);
    }

    @Test
    void testUniformWindowHitsUpperBound() {
        List<Integer> digits = new ArrayList<>();
        for (int round = 0; round < 3; round++) {
            for (int d = 0; d < 10; d++) {
                digits.add(d);
            }
        }

        double h = EntropyCalculator.entropy(digits);

        assertEquals(EntropyCalculator.MAX_ENTROPY, h, 1e-9);
        assertTrue(h <= EntropyCalculator.MAX_ENTROPY, "Entropy never exceeds log2(10)");
    }

    @Test
    void testEvenSplitIsOneBit() {
        assertEquals(1.0, EntropyCalculator.entropy(List.of(2, 7, 2, 7, 2, 7)), 1e-9);
    }

    @Test
    void testEmptyWindow() {
        assertEquals(0.0, EntropyCalculator.entropy(List.of()), 1e-9);
    }

    @Test
    void testRegimeThresholds() {
        assertEquals(Regime.STABLE, classifier.classify(2.0));
        assertEquals(Regime.TRANSITION, classifier.classify(2.8));
        assertEquals(Regime.TRANSITION, classifier.classify(3.1));
        assertEquals(Regime.CHAOS, classifier.classify(3.15));
        assertEquals(Regime.CHAOS, classifier.classify(EntropyCalculator.MAX_ENTROPY));
    }

    @Test
    void testRequiredConfidence() {
        assertEquals(0.25, classifier.requiredConfidence(Regime.STABLE), 1e-9);
        assertEquals(0.40, classifier.requiredConfidence(Regime.TRANSITION), 1e-9);
        assertTrue(Double.isInfinite(classifier.requiredConfidence(Regime.CHAOS)),
            "Chaos can never be traded");
    }
}
