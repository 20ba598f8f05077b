package in.digitflow.service.learning;

import in.digitflow.domain.learning.IndicatorStats;
import in.digitflow.domain.learning.LearningRecord;
import in.digitflow.domain.learning.LearningSummary;
import in.digitflow.domain.learning.SessionStats;
import in.digitflow.domain.learning.TradeOutcome;
import in.digitflow.domain.repository.LearningMemoryRepository;
import in.digitflow.domain.repository.LearningMemoryRepository.StoredDocument;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-market adaptive learning state.
 *
 * Reads go through a short TTL cache so the per-cycle weight lookups do not hit the store.
 * Outcomes are applied under a per-market lock and written through.
 * Store failures are logged and swallowed: trading continues on the cached record or defaults.
 */
public final class LearningMemory {
    private static final Logger log = LoggerFactory.getLogger(LearningMemory.class);

    private record Cached(LearningRecord record, Instant loadedAt) {}

    private final LearningMemoryRepository repository;
    private final LearningRecordMigrator migrator;
    private final Duration cacheTtl;
    private final Clock clock;

    private final Map<String, Cached> cache = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public LearningMemory(LearningMemoryRepository repository, Duration cacheTtl, Clock clock) {
        this.repository = repository;
        this.migrator = new LearningRecordMigrator();
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    /**
     * Current record for the market: cached if fresh, else loaded (and migrated) from the store.
     */
    public LearningRecord load(String market) {
        Instant now = clock.instant();
        Cached cached = cache.get(market);
        if (cached != null && Duration.between(cached.loadedAt(), now).compareTo(cacheTtl) < 0) {
            return cached.record();
        }

        LearningRecord record;
        try {
            Optional<StoredDocument> stored = repository.load(market);
            if (stored.isPresent()) {
                StoredDocument doc = stored.get();
                record = migrator.fromDocument(market, doc.schemaVersion(), doc.document(), now);
                if (doc.schemaVersion() != LearningRecord.SCHEMA_VERSION) {
                    persist(market, record);
                }
            } else {
                record = LearningRecord.defaults(market, now);
            }
        } catch (RuntimeException e) {
            record = cached != null ? cached.record() : LearningRecord.defaults(market, now);
            log.warn("[LearningMemory] Load failed for {}, using {}: {}",
                market, cached != null ? "cached record" : "defaults", e.getMessage());
        }

        cache.put(market, new Cached(record, now));
        return record;
    }

    /**
     * Replace the market's record and write it through. Last write wins.
     */
    public void save(String market, LearningRecord record) {
        cache.put(market, new Cached(record, clock.instant()));
        persist(market, record);
    }

    public IndicatorWeights weights(String market) {
        return load(market).weights();
    }

    /**
     * Apply a closed trade: indicator scores, weights, side stats, regime, session and trade history.
     */
    public LearningRecord recordOutcome(String market, TradeOutcome outcome) {
        ReentrantLock lock = locks.computeIfAbsent(market, k -> new ReentrantLock());
        lock.lock();
        try {
            LearningRecord updated = applyOutcome(load(market), outcome, clock.instant());
            save(market, updated);
            log.info("[LearningMemory] {} {} {} → trades={} winRate={} weights={}",
                market, outcome.side(), outcome.won() ? "WIN" : "LOSS",
                updated.performance().totalTrades(),
                String.format("%.1f%%", updated.performance().winRate() * 100),
                updated.weights());
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public LearningSummary summary(String market) {
        return LearningSummary.of(load(market));
    }

    /**
     * Drop the market's learning and start again from defaults.
     */
    public void reset(String market) {
        cache.remove(market);
        try {
            repository.delete(market);
            log.info("[LearningMemory] Reset {}", market);
        } catch (RuntimeException e) {
            log.error("[LearningMemory] Reset failed for {}: {}", market, e.getMessage());
        }
    }

    static LearningRecord applyOutcome(LearningRecord current, TradeOutcome outcome, Instant now) {
        Side winning = outcome.winningSide();
        Map<Indicator, IndicatorStats> indicators = new EnumMap<>(current.indicatorPerformance());
        outcome.votes().forEach((indicator, side) ->
            indicators.put(indicator, indicators.get(indicator).record(side == winning)));

        IndicatorWeights weights = WeightCalculator.weights(indicators, current.weights().entropy());

        SessionStats session = current.currentSession();
        if (outcome.sessionId() != null && (session == null || !outcome.sessionId().equals(session.sessionId()))) {
            session = SessionStats.start(outcome.sessionId(), outcome.closedAt() != null ? outcome.closedAt() : now);
        }
        if (session != null) {
            session = session.record(outcome.won());
        }

        List<TradeOutcome> trades = new ArrayList<>(current.lastTrades().size() + 1);
        trades.add(outcome);
        trades.addAll(current.lastTrades());
        if (trades.size() > LearningRecord.MAX_TRADES) {
            trades = trades.subList(0, LearningRecord.MAX_TRADES);
        }

        return new LearningRecord(
            LearningRecord.SCHEMA_VERSION,
            current.market(),
            weights,
            indicators,
            current.performance().record(outcome.side(), outcome.won()),
            current.regime().observe(outcome.regime(), outcome.closedAt() != null ? outcome.closedAt() : now),
            session,
            trades,
            now
        );
    }

    private void persist(String market, LearningRecord record) {
        try {
            repository.save(market, LearningRecord.SCHEMA_VERSION, migrator.toDocument(record));
        } catch (RuntimeException e) {
            log.error("[LearningMemory] Failed to persist {} (continuing in memory): {}", market, e.getMessage());
        }
    }
}
