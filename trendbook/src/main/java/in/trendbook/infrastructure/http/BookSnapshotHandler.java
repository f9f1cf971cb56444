package in.trendbook.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.trendbook.domain.book.BookDepth;
import in.trendbook.domain.book.PriceLevel;
import in.trendbook.domain.book.TopOfBook;
import in.trendbook.service.book.OrderBookEngine;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /book?depth=N - top of book, depth and sequence state as JSON.
 *
 * <pre>
 * {"symbol":"BTCUSDT","lastSequenceId":18521290,"resyncRequired":false,
 *  "bestBid":"16493.5","bestAsk":"16494","spread":"0.5","imbalance":"0.12",
 *  "bids":[["16493.5","0.006"]],"asks":[["16494","0.029"]]}
 * </pre>
 */
public final class BookSnapshotHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(BookSnapshotHandler.class);
    private static final int DEFAULT_DEPTH = 10;
    private static final int MAX_DEPTH = 200;

    private final OrderBookEngine book;
    private final ObjectMapper mapper;

    public BookSnapshotHandler(OrderBookEngine book, ObjectMapper mapper) {
        this.book = book;
        this.mapper = mapper;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        int depth = parseDepth(exchange.getQueryParameters().get("depth"));
        if (depth < 0) {
            exchange.setStatusCode(400);
            exchange.getResponseSender().send("depth must be an integer between 0 and " + MAX_DEPTH);
            return;
        }

        TopOfBook top = book.bestBidAsk();
        BookDepth levels = book.depth(depth);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", book.symbol());
        body.put("lastSequenceId", book.lastAppliedSequenceId().isPresent()
            ? book.lastAppliedSequenceId().getAsLong() : null);
        body.put("resyncRequired", book.resyncRequired());
        body.put("bestBid", top.hasBid() ? top.bidPrice().toPlainString() : null);
        body.put("bestAsk", top.hasAsk() ? top.askPrice().toPlainString() : null);
        body.put("spread", top.isTwoSided() ? top.spread().toPlainString() : null);
        body.put("imbalance", book.imbalance(depth).toPlainString());
        body.put("bids", pairs(levels.bids()));
        body.put("asks", pairs(levels.asks()));

        try {
            String json = mapper.writeValueAsString(body);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(json);
        } catch (JsonProcessingException e) {
            log.error("[BookSnapshotHandler] Failed to serialize book: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error serializing book");
        }
    }

    private static List<List<String>> pairs(List<PriceLevel> levels) {
        return levels.stream()
            .map(l -> List.of(l.price().toPlainString(), l.quantity().toPlainString()))
            .toList();
    }

    /**
     * @return requested depth, the default when absent, or -1 when invalid
     */
    private static int parseDepth(Deque<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_DEPTH;
        }
        try {
            int depth = Integer.parseInt(values.getFirst());
            return depth >= 0 && depth <= MAX_DEPTH ? depth : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
