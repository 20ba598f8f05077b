package in.digitflow.config;

/**
 * Thresholds and windows for the signal engine.
 *
 * Every indicator reads its own window size from here; windows shrink to the
 * available history when fewer digits have been observed.
 */
public record SignalConfig(
    int warmupDigits,                 // No signal below this many observed digits

    int entropyWindow,                // Digits used for Shannon entropy
    double transitionEntropy,         // Entropy >= this => TRANSITION
    double chaosEntropy,              // Entropy >= this => CHAOS (no trade)

    int markovDepth,                  // Digits scanned for the transition row
    int markovMinObservations,        // Successors of the current digit needed
    double markovSignificance,        // Top row probability must exceed this

    int exhaustionWindow,
    double exhaustionThreshold,       // (0.1 - minFreq) / 0.1 must exceed this

    int streakWindow,
    int streakMin,                    // Streak fires at this length
    int streakReversal,               // Streak at or above this suggests reversion
    boolean circularDeltas,           // 9 -> 0 counts as +1

    int biasWindow,
    double biasThreshold,             // Imbalance needed to suggest a side
    double biasReversion,             // Imbalance above this suggests the opposite side

    int bayesianPriorWindow,
    int bayesianLikelihoodDepth,
    double bayesianMinConfidence,     // |P(over) - P(under)| must exceed this

    double stableMinConfidence,
    double transitionMinConfidence,
    double contradictionRatio,        // voteRatio below this with >= minFactors => contradiction
    int minFactors,

    double posteriorWeight            // Digit score = posterior * w + (1 - freq) * (1 - w)
) {
    public static SignalConfig defaults() {
        return new SignalConfig(
            25,
            30, 2.8, 3.15,
            50, 5, 0.15,
            50, 0.4,
            12, 3, 4, false,
            15, 0.2, 0.3,
            30, 60, 0.1,
            0.25, 0.40, 0.15, 2,
            0.7
        );
    }

    public boolean isValid() {
        return warmupDigits > 0
            && entropyWindow > 1
            && transitionEntropy < chaosEntropy
            && markovDepth > 1 && markovMinObservations > 0
            && exhaustionWindow > 0 && streakWindow > 1 && biasWindow > 0
            && bayesianPriorWindow > 0 && bayesianLikelihoodDepth > 1
            && streakMin > 0 && streakReversal >= streakMin
            && biasReversion >= biasThreshold
            && stableMinConfidence > 0 && stableMinConfidence <= transitionMinConfidence
            && minFactors > 0
            && posteriorWeight >= 0 && posteriorWeight <= 1;
    }
}
