package in.trendbook.infrastructure.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.trendbook.domain.data.Candle;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses Bybit v5 kline REST responses.
 *
 * <pre>
 * {"retCode":0,"retMsg":"OK","result":{"symbol":"BTCUSDT","category":"linear",
 *  "list":[["1670608800000","17071","17073","17027","17055.5","268611","15.74462667"], ...]}}
 * </pre>
 *
 * Rows are [startMs, open, high, low, close, volume, turnover], newest first on the wire;
 * the result is returned oldest first.
 */
public final class KlineParser {
    private static final String SOURCE = "kline";

    private final ObjectMapper mapper;

    public KlineParser() {
        this(new ObjectMapper());
    }

    public KlineParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MalformedMessageException on invalid JSON, a non-zero retCode or an unusable row
     */
    public List<Candle> parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(SOURCE, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null) {
            throw new MalformedMessageException(SOURCE, "empty response");
        }

        JsonNode rows;
        if (root.isArray()) {
            rows = root;
        } else {
            int retCode = root.path("retCode").asInt(0);
            if (retCode != 0) {
                throw new MalformedMessageException(SOURCE,
                    "retCode " + retCode + ": " + root.path("retMsg").asText(""));
            }
            rows = root.path("result").path("list");
        }
        if (!rows.isArray()) {
            throw new MalformedMessageException(SOURCE, "missing result.list array");
        }

        List<Candle> candles = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            candles.add(toCandle(row));
        }
        candles.sort(Comparator.comparing(Candle::openTime));
        return candles;
    }

    private static Candle toCandle(JsonNode row) {
        if (!row.isArray() || row.size() < 5) {
            throw new MalformedMessageException(SOURCE, "kline row must have at least 5 fields: " + row);
        }
        try {
            return new Candle(
                Instant.ofEpochMilli(Long.parseLong(row.get(0).asText())),
                new BigDecimal(row.get(1).asText()),
                new BigDecimal(row.get(2).asText()),
                new BigDecimal(row.get(3).asText()),
                new BigDecimal(row.get(4).asText()),
                row.size() > 5 ? new BigDecimal(row.get(5).asText()) : BigDecimal.ZERO,
                row.size() > 6 ? new BigDecimal(row.get(6).asText()) : BigDecimal.ZERO
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(SOURCE, "bad kline row " + row + ": " + e.getMessage(), e);
        }
    }
}
