package in.digitflow.infrastructure.venue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.digitflow.domain.data.Tick;

import java.math.BigDecimal;

/**
 * Frame builders and parsers for the venue's JSON WebSocket API.
 *
 * Requests are correlated by an integer {@code req_id} echoed in the response;
 * stream frames carry {@code subscription.id}.
 */
public final class VenueProtocol {

    static final ObjectMapper MAPPER = new ObjectMapper();

    // ═══════════════════════════════════════════════════════════════
    // OUTBOUND
    // ═══════════════════════════════════════════════════════════════

    public static ObjectNode authorize(String token) {
        return MAPPER.createObjectNode().put("authorize", token);
    }

    public static ObjectNode ticks(String market) {
        return MAPPER.createObjectNode().put("ticks", market).put("subscribe", 1);
    }

    public static ObjectNode forget(String subscriptionId) {
        return MAPPER.createObjectNode().put("forget", subscriptionId);
    }

    public static ObjectNode ping() {
        return MAPPER.createObjectNode().put("ping", 1);
    }

    public static ObjectNode balance() {
        return MAPPER.createObjectNode().put("balance", 1);
    }

    /**
     * Digit contract purchase at the given stake.
     */
    public static ObjectNode buy(String contractType, String market, int barrier, BigDecimal stake,
                                 String currency, int duration, String durationUnit) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("buy", 1);
        frame.put("price", stake);
        ObjectNode p = frame.putObject("parameters");
        p.put("amount", stake);
        p.put("basis", "stake");
        p.put("contract_type", contractType);
        p.put("currency", currency);
        p.put("duration", duration);
        p.put("duration_unit", durationUnit);
        p.put("symbol", market);
        p.put("barrier", String.valueOf(barrier));
        return frame;
    }

    /**
     * Sell at market (price 0 accepts any bid).
     */
    public static ObjectNode sell(String contractId) {
        ObjectNode frame = MAPPER.createObjectNode();
        putContractId(frame, "sell", contractId);
        frame.put("price", 0);
        return frame;
    }

    public static ObjectNode watchContract(String contractId) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("proposal_open_contract", 1);
        putContractId(frame, "contract_id", contractId);
        frame.put("subscribe", 1);
        return frame;
    }

    private static void putContractId(ObjectNode frame, String field, String contractId) {
        try {
            frame.put(field, Long.parseLong(contractId));
        } catch (NumberFormatException e) {
            frame.put(field, contractId);
        }
    }

    public static String encode(ObjectNode frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode frame", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // INBOUND
    // ═══════════════════════════════════════════════════════════════

    public static VenueMessage parse(String raw) {
        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Not JSON: " + abbreviate(raw), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Not a JSON object: " + abbreviate(raw), null);
        }

        String msgType = root.path("msg_type").asText(null);
        JsonNode error = root.path("error");
        if (msgType == null && error.isMissingNode()) {
            throw new MalformedFrameException("No msg_type: " + abbreviate(raw), null);
        }

        Integer reqId = root.hasNonNull("req_id") && root.get("req_id").canConvertToInt()
            ? root.get("req_id").asInt() : null;
        String subscriptionId = root.path("subscription").path("id").asText(null);
        String errorCode = error.isObject() ? error.path("code").asText("UnknownError") : null;
        String errorMessage = error.isObject() ? error.path("message").asText("") : null;
        return new VenueMessage(msgType != null ? msgType : "error", reqId, subscriptionId, errorCode, errorMessage, root);
    }

    /**
     * Tick from a {@code tick} frame.
     */
    public static Tick tick(VenueMessage message) {
        JsonNode t = message.payload();
        String market = t.path("symbol").asText(null);
        JsonNode quote = t.get("quote");
        if (market == null || quote == null || !quote.isNumber()) {
            throw new MalformedFrameException("Tick without symbol/quote", null);
        }
        return Tick.of(market, quote.decimalValue(), t.path("epoch").asLong(0));
    }

    public static ContractUpdate contractUpdate(VenueMessage message) {
        JsonNode c = message.body().path("proposal_open_contract");
        if (!c.hasNonNull("contract_id")) {
            return null;
        }
        return new ContractUpdate(
            c.get("contract_id").asText(),
            decimal(c, "profit"),
            c.path("is_sold").asInt(0) == 1 || c.path("is_sold").asBoolean(false),
            c.path("status").asText("open"),
            decimal(c, "buy_price"),
            decimal(c, "payout"),
            decimal(c, "entry_tick"),
            decimal(c, "exit_tick")
        );
    }

    /**
     * Receipt from a {@code buy} response.
     */
    public static BuyReceipt buyReceipt(VenueMessage message) {
        JsonNode b = message.body().path("buy");
        if (!b.hasNonNull("contract_id")) {
            throw new MalformedFrameException("Buy response without contract_id", null);
        }
        return new BuyReceipt(
            b.get("contract_id").asText(),
            b.path("transaction_id").asText(null),
            decimal(b, "buy_price"),
            decimal(b, "payout")
        );
    }

    static BigDecimal decimal(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.decimalValue();
        }
        try {
            return new BigDecimal(v.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String raw) {
        if (raw == null) return "null";
        return raw.length() > 120 ? raw.substring(0, 120) + "..." : raw;
    }

    private VenueProtocol() {}
}
