package in.trendbook.application.port.output;

import in.trendbook.domain.data.Candle;

import java.util.List;

/**
 * Bulk historical bar fetch.
 */
public interface CandleSource {
    /**
     * @param symbol   instrument
     * @param interval exchange interval code declared by the active strategy
     * @param limit    maximum number of bars
     * @return bars in ascending openTime order
     */
    List<Candle> fetchCandles(String symbol, String interval, int limit);
}
