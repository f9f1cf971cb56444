package in.trendbook.infrastructure.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.trendbook.domain.account.OrderRecord;
import in.trendbook.domain.account.PositionUpdate;
import in.trendbook.domain.account.WalletUpdate;
import in.trendbook.domain.order.OrderSide;
import in.trendbook.domain.order.OrderStatus;
import in.trendbook.domain.order.OrderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses Bybit v5 private stream messages (topics {@code position}, {@code order}, {@code wallet}).
 *
 * Position size is signed on the way in: side "Sell" makes it negative, side "" / "None" is flat.
 * Unknown topics (pong, auth, execution) decode to {@link AccountEvents#empty()}. A single
 * unusable record is skipped with a warning; the rest of the message still decodes.
 */
public final class AccountEventParser {
    private static final Logger log = LoggerFactory.getLogger(AccountEventParser.class);
    private static final String SOURCE = "account";

    private final ObjectMapper mapper;

    public AccountEventParser() {
        this(new ObjectMapper());
    }

    public AccountEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MalformedMessageException on invalid JSON or a topic whose data is not an array
     */
    public AccountEvents parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(SOURCE, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException(SOURCE, "message is not a JSON object");
        }

        String topic = root.path("topic").asText("");
        if (!topic.startsWith("position") && !topic.startsWith("order") && !topic.startsWith("wallet")) {
            return AccountEvents.empty();
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isArray()) {
            throw new MalformedMessageException(SOURCE, "topic " + topic + " has no data array");
        }

        List<PositionUpdate> positions = new ArrayList<>();
        List<OrderRecord> orders = new ArrayList<>();
        List<WalletUpdate> wallets = new ArrayList<>();
        for (JsonNode item : data) {
            try {
                if (topic.startsWith("position")) {
                    positions.add(position(item));
                } else if (topic.startsWith("order")) {
                    orders.add(order(item));
                } else {
                    wallets.add(wallet(item));
                }
            } catch (IllegalArgumentException e) {
                log.warn("[{}] Skipping unusable {} record {}: {}", SOURCE, topic, item, e.getMessage());
            }
        }
        return new AccountEvents(positions, orders, wallets);
    }

    private static PositionUpdate position(JsonNode item) {
        BigDecimal size = decimal(item, "size", BigDecimal.ZERO);
        String side = item.path("side").asText("");
        if ("Sell".equalsIgnoreCase(side)) {
            size = size.negate();
        } else if (!"Buy".equalsIgnoreCase(side)) {
            size = BigDecimal.ZERO;
        }
        return new PositionUpdate(item.path("symbol").asText(null), size, decimal(item, "avgPrice", BigDecimal.ZERO));
    }

    private static OrderRecord order(JsonNode item) {
        OrderType type = OrderType.fromWire(item.path("orderType").asText(null));
        BigDecimal price = decimal(item, "price", null);
        if (price != null && price.signum() == 0) {
            price = null;
        }
        return new OrderRecord(
            item.path("orderId").asText(null),
            OrderSide.fromWire(item.path("side").asText(null)),
            price,
            decimal(item, "qty", BigDecimal.ZERO),
            type,
            OrderStatus.fromWire(item.path("orderStatus").asText(null))
        );
    }

    private static WalletUpdate wallet(JsonNode item) {
        return new WalletUpdate(item.path("accountType").asText(null), decimal(item, "totalEquity", null));
    }

    private static BigDecimal decimal(JsonNode item, String field, BigDecimal fallback) {
        String text = item.path(field).asText("");
        if (text.isEmpty()) {
            return fallback;
        }
        return new BigDecimal(text);   // NumberFormatException is an IllegalArgumentException
    }
}
