package in.trendbook.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Strategy parameters.
 *
 * Fractions are plain ratios: 0.0002 means 0.02%.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyConfig(
    @JsonProperty("strategy")
    String strategy,                    // supertrend | market-making

    @JsonProperty("klineInterval")
    String klineInterval,               // exchange interval code, e.g. "15" (minutes)

    @JsonProperty("klineLimit")
    int klineLimit,                     // bars fetched per poll

    @JsonProperty("atrPeriod")
    int atrPeriod,

    @JsonProperty("multiplier")
    double multiplier,                  // Supertrend band width in ATRs

    @JsonProperty("orderSize")
    BigDecimal orderSize,

    @JsonProperty("maxPositionSize")
    BigDecimal maxPositionSize,

    @JsonProperty("positionBuffer")
    BigDecimal positionBuffer,          // tolerance above max before the safety valve trips

    @JsonProperty("maxOpenEntryOrdersPerSide")
    int maxOpenEntryOrdersPerSide,

    @JsonProperty("repriceThresholdPct")
    double repriceThresholdPct,         // relative deviation that triggers a reprice

    @JsonProperty("spreadPct")
    double spreadPct,                   // market-making quote offset from best

    @JsonProperty("tickSize")
    BigDecimal tickSize                 // optional; null means the price's own ulp
) {
    public static StrategyConfig defaults() {
        return new StrategyConfig(
            "supertrend",
            "15",
            200,
            10,
            3.0,
            new BigDecimal("0.01"),
            new BigDecimal("0.05"),
            new BigDecimal("0.01"),
            1,
            0.0002,
            0.0005,
            null
        );
    }

    public StrategyConfig withStrategy(String name) {
        return new StrategyConfig(name, klineInterval, klineLimit, atrPeriod, multiplier, orderSize,
            maxPositionSize, positionBuffer, maxOpenEntryOrdersPerSide, repriceThresholdPct, spreadPct, tickSize);
    }

    /**
     * Validate configuration values.
     */
    public boolean isValid() {
        return strategy != null && !strategy.isBlank()
            && klineInterval != null && !klineInterval.isBlank()
            && klineLimit > atrPeriod
            && atrPeriod >= 1
            && multiplier > 0
            && orderSize != null && orderSize.signum() > 0
            && maxPositionSize != null && maxPositionSize.signum() > 0
            && positionBuffer != null && positionBuffer.signum() >= 0
            && maxOpenEntryOrdersPerSide >= 1
            && repriceThresholdPct > 0 && repriceThresholdPct < 1
            && spreadPct >= 0 && spreadPct < 1
            && (tickSize == null || tickSize.signum() > 0);
    }

    /**
     * Cap on outstanding entry quantity per side.
     */
    public BigDecimal maxOutstandingEntryQuantity() {
        return orderSize.multiply(BigDecimal.valueOf(maxOpenEntryOrdersPerSide));
    }
}
