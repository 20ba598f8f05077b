package in.digitflow.service.signal;

import in.digitflow.config.SignalConfig;
import in.digitflow.domain.signal.Regime;

/**
 * Maps entropy to a regime and each regime to the confidence a trade needs.
 */
public final class RegimeClassifier {

    private final SignalConfig config;

    public RegimeClassifier(SignalConfig config) {
        this.config = config;
    }

    public Regime classify(double entropy) {
        if (entropy >= config.chaosEntropy()) {
            return Regime.CHAOS;
        }
        if (entropy >= config.transitionEntropy()) {
            return Regime.TRANSITION;
        }
        return Regime.STABLE;
    }

    /**
     * Minimum vote ratio for a trade. Chaos is above any attainable ratio.
     */
    public double requiredConfidence(Regime regime) {
        return switch (regime) {
            case STABLE -> config.stableMinConfidence();
            case TRANSITION -> config.transitionMinConfidence();
            case CHAOS -> Double.POSITIVE_INFINITY;
        };
    }
}
