package in.trendbook.domain.book;

/**
 * One raw [price, quantity] pair as received from the market-data feed.
 *
 * Values are kept as wire strings; parsing and validation happen per entry
 * inside the engine so that one bad pair never rejects the whole message.
 */
public record BookEntry(String price, String quantity) {

    public static BookEntry of(String price, String quantity) {
        return new BookEntry(price, quantity);
    }
}
