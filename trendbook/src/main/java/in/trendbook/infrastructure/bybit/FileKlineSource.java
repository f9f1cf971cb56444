package in.trendbook.infrastructure.bybit;

import in.trendbook.application.port.output.CandleSource;
import in.trendbook.domain.data.Candle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the latest kline REST response written to a file by an external collector.
 * The file is re-read on every fetch; the newest {@code limit} candles are returned.
 */
public final class FileKlineSource implements CandleSource {

    private final Path file;
    private final KlineParser parser;

    public FileKlineSource(Path file, KlineParser parser) {
        this.file = file;
        this.parser = parser;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, String interval, int limit) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read kline file " + file, e);
        }
        List<Candle> candles = parser.parse(json);
        return candles.size() <= limit ? candles : candles.subList(candles.size() - limit, candles.size());
    }
}
