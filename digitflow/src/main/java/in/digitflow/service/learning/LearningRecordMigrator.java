package in.digitflow.service.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.digitflow.domain.learning.IndicatorStats;
import in.digitflow.domain.learning.LearningRecord;
import in.digitflow.domain.learning.PerformanceStats;
import in.digitflow.domain.learning.RegimeHistory;
import in.digitflow.domain.learning.RegimeTransition;
import in.digitflow.domain.learning.SessionStats;
import in.digitflow.domain.learning.SideStats;
import in.digitflow.domain.learning.TradeOutcome;
import in.digitflow.domain.signal.Indicator;
import in.digitflow.domain.signal.IndicatorWeights;
import in.digitflow.domain.signal.Regime;
import in.digitflow.domain.signal.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts stored learning documents to the current {@link LearningRecord} schema.
 *
 * Version 2 is the legacy two-blob layout ({@code weights_data} / {@code performance_data})
 * with lowercase indicator keys and flat regime counters. Version 3 is the record serialized as-is.
 */
public final class LearningRecordMigrator {
    private static final Logger log = LoggerFactory.getLogger(LearningRecordMigrator.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static final int LEGACY_VERSION = 2;

    public JsonNode toDocument(LearningRecord record) {
        return MAPPER.valueToTree(record);
    }

    public LearningRecord fromDocument(String market, int schemaVersion, JsonNode document, Instant now) {
        if (schemaVersion == LearningRecord.SCHEMA_VERSION) {
            try {
                return MAPPER.treeToValue(document, LearningRecord.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Unreadable learning record for " + market, e);
            }
        }
        if (schemaVersion == LEGACY_VERSION) {
            log.info("[LearningMemory] Migrating {} from schema v{} to v{}", market, schemaVersion, LearningRecord.SCHEMA_VERSION);
            return fromLegacy(market, document, now);
        }
        throw new IllegalArgumentException("Unsupported learning schema version " + schemaVersion + " for " + market);
    }

    private LearningRecord fromLegacy(String market, JsonNode document, Instant now) {
        JsonNode weightsData = document.path("weights_data");
        JsonNode performanceData = document.path("performance_data");

        JsonNode w = weightsData.path("weights");
        IndicatorWeights weights = new IndicatorWeights(
            IndicatorWeights.clamp(w.path("markov").asDouble(1.0)),
            IndicatorWeights.clamp(w.path("exhaustion").asDouble(1.0)),
            IndicatorWeights.clamp(w.path("streak").asDouble(1.0)),
            IndicatorWeights.clamp(w.path("bias").asDouble(1.0)),
            IndicatorWeights.clamp(w.path("entropy").asDouble(1.0))
        );

        Map<Indicator, IndicatorStats> indicators = new EnumMap<>(Indicator.class);
        JsonNode ip = weightsData.path("indicatorPerformance");
        for (Indicator indicator : Indicator.values()) {
            JsonNode node = ip.path(indicator.name().toLowerCase());
            indicators.put(indicator, new IndicatorStats(node.path("correct").asInt(0), node.path("wrong").asInt(0)));
        }

        JsonNode perf = performanceData.path("performance");
        Map<Side, SideStats> bySide = new EnumMap<>(Side.class);
        for (Side side : Side.values()) {
            JsonNode node = perf.path(side.name());
            bySide.put(side, new SideStats(node.path("trades").asInt(0), node.path("wins").asInt(0), node.path("losses").asInt(0)));
        }
        PerformanceStats performance = new PerformanceStats(bySide,
            perf.path("totalTrades").asInt(0),
            perf.path("totalWins").asInt(0),
            perf.path("totalLosses").asInt(0),
            perf.path("winRate").asDouble(0.0));

        JsonNode r = performanceData.path("regime");
        List<RegimeTransition> transitions = new ArrayList<>();
        for (JsonNode t : r.path("history")) {
            transitions.add(new RegimeTransition(
                regime(t.path("from").asText(null)),
                regime(t.path("to").asText(null)),
                instant(t.path("timestamp").asText(null), now)));
            if (transitions.size() == RegimeHistory.MAX_HISTORY) {
                break;
            }
        }
        Map<Regime, Integer> counts = new EnumMap<>(Regime.class);
        counts.put(Regime.STABLE, r.path("stableCount").asInt(0));
        counts.put(Regime.TRANSITION, r.path("transitionCount").asInt(0));
        counts.put(Regime.CHAOS, r.path("chaosCount").asInt(0));
        RegimeHistory regime = new RegimeHistory(regime(r.path("current").asText(null)), transitions, counts);

        JsonNode cs = performanceData.path("currentSession");
        SessionStats session = null;
        if (cs.hasNonNull("sessionId")) {
            session = new SessionStats(cs.path("sessionId").asText(),
                instant(cs.path("startedAt").asText(null), now),
                cs.path("trades").asInt(0), cs.path("wins").asInt(0), cs.path("losses").asInt(0));
        }

        List<TradeOutcome> trades = new ArrayList<>();
        for (JsonNode t : performanceData.path("lastTrades")) {
            Side side;
            try {
                side = Side.valueOf(t.path("side").asText("").toUpperCase());
            } catch (IllegalArgumentException e) {
                log.warn("[LearningMemory] Skipping legacy trade with side '{}' for {}", t.path("side").asText(), market);
                continue;
            }
            boolean won = t.path("won").asBoolean(false);
            // Legacy trades kept only indicator names; they all voted for the traded side
            Map<Indicator, Side> votes = new EnumMap<>(Indicator.class);
            for (JsonNode name : t.path("indicators")) {
                try {
                    votes.put(Indicator.valueOf(name.asText().toUpperCase()), side);
                } catch (IllegalArgumentException e) {
                    log.debug("[LearningMemory] Unknown legacy indicator '{}'", name.asText());
                }
            }
            trades.add(new TradeOutcome(null, null, side, t.path("digit").asInt(0), won, 0.0,
                t.path("confidence").asDouble(0.0), regime(t.path("regime").asText(null)), votes,
                instant(t.path("timestamp").asText(null), now)));
            if (trades.size() == LearningRecord.MAX_TRADES) {
                break;
            }
        }

        return new LearningRecord(LearningRecord.SCHEMA_VERSION, market, weights, indicators, performance,
            regime, session, trades, now);
    }

    private static Regime regime(String label) {
        try {
            return Regime.fromLabel(label);
        } catch (IllegalArgumentException e) {
            return Regime.STABLE;
        }
    }

    private static Instant instant(String text, Instant fallback) {
        if (text == null || text.isEmpty()) {
            return fallback;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }
}
