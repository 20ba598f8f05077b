package in.digitflow.service.risk;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Caps concurrently open contracts per market and overall.
 */
public final class CorrelationGuard {

    private final int maxPerMarket;
    private final int maxGlobal;
    private final Map<String, Set<String>> openByMarket = new HashMap<>();
    private int openTotal = 0;

    public CorrelationGuard(int maxPerMarket, int maxGlobal) {
        this.maxPerMarket = maxPerMarket;
        this.maxGlobal = maxGlobal;
    }

    public synchronized RiskDecision check(String market) {
        int forMarket = openByMarket.getOrDefault(market, Set.of()).size();
        if (forMarket >= maxPerMarket) {
            return RiskDecision.reject(RiskDecision.EXPOSURE_LIMIT,
                forMarket + " open on " + market + " (max " + maxPerMarket + ")");
        }
        if (openTotal >= maxGlobal) {
            return RiskDecision.reject(RiskDecision.EXPOSURE_LIMIT, openTotal + " open overall (max " + maxGlobal + ")");
        }
        return RiskDecision.allow();
    }

    public synchronized void register(String market, String contractId) {
        if (openByMarket.computeIfAbsent(market, k -> new HashSet<>()).add(contractId)) {
            openTotal++;
        }
    }

    public synchronized void deregister(String market, String contractId) {
        Set<String> open = openByMarket.get(market);
        if (open != null && open.remove(contractId)) {
            openTotal--;
            if (open.isEmpty()) {
                openByMarket.remove(market);
            }
        }
    }

    public synchronized int openCount(String market) {
        return openByMarket.getOrDefault(market, Set.of()).size();
    }

    public synchronized int openTotal() {
        return openTotal;
    }
}
