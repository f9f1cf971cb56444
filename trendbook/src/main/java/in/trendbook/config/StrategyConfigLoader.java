package in.trendbook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link StrategyConfig} from a JSON file.
 *
 * Never returns null: a missing, unreadable or invalid file yields {@link StrategyConfig#defaults()}.
 */
public final class StrategyConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(StrategyConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StrategyConfigLoader() {}

    public static StrategyConfig load(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            log.info("No strategy config file found, using defaults: {}", configFile);
            return StrategyConfig.defaults();
        }
        try {
            StrategyConfig config = MAPPER.readValue(Files.readString(configFile), StrategyConfig.class);
            if (!config.isValid()) {
                log.warn("⚠️ Invalid strategy config in {}, using defaults: {}", configFile, config);
                return StrategyConfig.defaults();
            }
            log.info("✅ Loaded strategy config from: {} (strategy={})", configFile, config.strategy());
            return config;
        } catch (IOException e) {
            log.error("Failed to load strategy config, using defaults: {}", e.getMessage());
            return StrategyConfig.defaults();
        }
    }

    /**
     * Parse a JSON document. Unlike {@link #load(Path)} this does not fall back.
     *
     * @throws IllegalArgumentException if the JSON cannot be parsed or the values are invalid
     */
    public static StrategyConfig parse(String json) {
        try {
            StrategyConfig config = MAPPER.readValue(json, StrategyConfig.class);
            if (!config.isValid()) {
                throw new IllegalArgumentException("Invalid strategy configuration: " + config);
            }
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Unparseable strategy configuration: " + e.getMessage(), e);
        }
    }
}
