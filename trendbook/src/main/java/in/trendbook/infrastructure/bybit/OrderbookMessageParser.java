package in.trendbook.infrastructure.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.trendbook.domain.book.BookEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses Bybit v5 orderbook stream messages.
 *
 * <pre>
 * {"topic":"orderbook.50.BTCUSDT","type":"snapshot","ts":1672304484978,
 *  "data":{"s":"BTCUSDT","b":[["16493.50","0.006"]],"a":[["16611.00","0.029"]],"u":18521288,"seq":7961638724}}
 * </pre>
 *
 * The sequence id is the update id {@code u}, falling back to {@code seq}. Individual
 * [price, qty] pairs are passed through as strings; a pair of the wrong shape becomes an
 * entry with null fields so the book skips just that entry.
 */
public final class OrderbookMessageParser {
    private static final String SOURCE = "orderbook";

    private final ObjectMapper mapper;

    public OrderbookMessageParser() {
        this(new ObjectMapper());
    }

    public OrderbookMessageParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MalformedMessageException if the JSON or its envelope is unusable
     */
    public OrderbookMessage parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(SOURCE, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException(SOURCE, "message is not a JSON object");
        }

        OrderbookMessage.Type type = parseType(root.path("type").asText(null));
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new MalformedMessageException(SOURCE, "missing data object");
        }

        Long sequenceId = null;
        if (data.hasNonNull("u")) {
            sequenceId = sequenceId(data.get("u"), "u");
        } else if (data.hasNonNull("seq")) {
            sequenceId = sequenceId(data.get("seq"), "seq");
        }

        Instant ts = root.hasNonNull("ts") ? Instant.ofEpochMilli(root.get("ts").asLong()) : null;
        String symbol = data.path("s").asText(null);

        return new OrderbookMessage(type, symbol, entries(data.get("b"), "b"), entries(data.get("a"), "a"), sequenceId, ts);
    }

    /**
     * Integral JSON number, or a string holding one. Fractions, overflow and text are malformed.
     */
    private static long sequenceId(JsonNode node, String field) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new MalformedMessageException(SOURCE, "non-integral sequence id " + field + "=" + node.textValue(), e);
            }
        }
        throw new MalformedMessageException(SOURCE, "non-integral sequence id " + field + "=" + node);
    }

    private static OrderbookMessage.Type parseType(String type) {
        if ("snapshot".equalsIgnoreCase(type)) return OrderbookMessage.Type.SNAPSHOT;
        if ("delta".equalsIgnoreCase(type)) return OrderbookMessage.Type.DELTA;
        throw new MalformedMessageException(SOURCE, "unknown message type: " + type);
    }

    private static List<BookEntry> entries(JsonNode side, String field) {
        if (side == null || side.isNull()) {
            return null;
        }
        if (!side.isArray()) {
            throw new MalformedMessageException(SOURCE, "field '" + field + "' is not an array");
        }
        List<BookEntry> entries = new ArrayList<>(side.size());
        for (JsonNode pair : side) {
            if (pair.isArray() && pair.size() >= 2 && pair.get(0).isValueNode() && pair.get(1).isValueNode()) {
                entries.add(BookEntry.of(pair.get(0).asText(), pair.get(1).asText()));
            } else {
                entries.add(BookEntry.of(null, null));
            }
        }
        return entries;
    }
}
