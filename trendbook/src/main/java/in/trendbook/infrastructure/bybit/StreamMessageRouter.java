package in.trendbook.infrastructure.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * Routes raw stream messages by topic.
 *
 * - {@code orderbook.*} goes to the market-data handler
 * - {@code position*}, {@code order*}, {@code wallet*} go to the account handler
 * - everything else (pong, auth, subscribe acks) is dropped
 *
 * {@link #pump(BufferedReader)} reads one JSON message per line, which lets an external
 * stream recorder be piped into the process.
 */
public final class StreamMessageRouter {
    private static final Logger log = LoggerFactory.getLogger(StreamMessageRouter.class);

    public enum Route {
        ORDERBOOK,
        ACCOUNT,
        IGNORED
    }

    private final Consumer<String> orderbookHandler;
    private final Consumer<String> accountHandler;
    private final ObjectMapper mapper;

    public StreamMessageRouter(Consumer<String> orderbookHandler, Consumer<String> accountHandler) {
        this(orderbookHandler, accountHandler, new ObjectMapper());
    }

    public StreamMessageRouter(Consumer<String> orderbookHandler, Consumer<String> accountHandler,
                               ObjectMapper mapper) {
        this.orderbookHandler = orderbookHandler;
        this.accountHandler = accountHandler;
        this.mapper = mapper;
    }

    public Route route(String raw) {
        if (raw == null || raw.isBlank()) {
            return Route.IGNORED;
        }
        String topic;
        try {
            JsonNode root = mapper.readTree(raw);
            topic = root == null ? "" : root.path("topic").asText("");
        } catch (JsonProcessingException e) {
            log.warn("[router] Dropping unparseable message: {}", e.getOriginalMessage());
            return Route.IGNORED;
        }

        if (topic.startsWith("orderbook")) {
            orderbookHandler.accept(raw);
            return Route.ORDERBOOK;
        }
        if (topic.startsWith("position") || topic.startsWith("order") || topic.startsWith("wallet")) {
            accountHandler.accept(raw);
            return Route.ACCOUNT;
        }
        log.debug("[router] Ignoring topic '{}'", topic);
        return Route.IGNORED;
    }

    /**
     * Route every line until end of stream.
     *
     * @return number of routed (non-ignored) messages
     */
    public long pump(BufferedReader reader) throws IOException {
        long routed = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (route(line) != Route.IGNORED) {
                routed++;
            }
        }
        return routed;
    }
}
