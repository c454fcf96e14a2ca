package com.apex.decision.config;

import com.apex.decision.model.InstrumentConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "decision")
@Data
@Validated
public class DecisionEngineProperties {

    private boolean testingMode = false;
    private CooldownMode cooldownMode = CooldownMode.INERT;
    private RangingMode rangingMode = RangingMode.DISABLED;
    private boolean debug = false;

    @Valid
    private Cache cache = new Cache();
    @Valid
    private TradeLog tradeLog = new TradeLog();
    private Stats stats = new Stats();
    @Valid
    private Timer timer = new Timer();
    @Valid
    private Indicators indicators = new Indicators();
    @Valid
    private Trend trend = new Trend();
    @Valid
    private Defaults defaults = new Defaults();
    @Valid
    private List<Instrument> instruments = new ArrayList<>();
    private Execution execution = new Execution();
    private Risk risk = new Risk();
    private TradingWindow tradingWindow = new TradingWindow();
    private Audit audit = new Audit();

    /**
     * INERT records cooldowns but never gates on them; ENFORCED short-circuits
     * decisions while the relevant side is cooling down.
     */
    public enum CooldownMode {
        INERT,
        ENFORCED
    }

    /**
     * DISABLED treats every market as not ranging; PROVIDER asks the active signal provider.
     */
    public enum RangingMode {
        DISABLED,
        PROVIDER
    }

    @Data
    public static class Cache {
        private Duration priceTtl = Duration.ofMillis(500);
        private Duration positionTtl = Duration.ofMillis(1500);
        private Duration analysisTtl = Duration.ofSeconds(5);
        private Duration decisionTtl = Duration.ofSeconds(5);
        private Duration indicatorTtl = Duration.ofSeconds(60);
        @Positive
        private double decisionConfidenceTolerance = 1.0;
    }

    @Data
    public static class TradeLog {
        @Min(1)
        private int capacity = 100;
    }

    @Data
    public static class Stats {
        private String zone = "UTC";
    }

    @Data
    public static class Timer {
        private boolean enabled = true;
        @Min(50)
        private long intervalMs = 1000;
        private Duration statusInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class Indicators {
        @Min(1)
        private int fastPeriod = 10;
        @Min(2)
        private int slowPeriod = 30;
        @Min(1)
        private int atrPeriod = 14;
        private Duration barLength = Duration.ofMinutes(1);
        @Min(10)
        private int maxBars = 500;
        private boolean batchRefresh = true;
    }

    @Data
    public static class Trend {
        @Positive
        private double neutralBandPercent = 0.02;
        @Positive
        private double fullStrengthPercent = 0.5;
        @Positive
        private double rangingAtrPercent = 0.05;
    }

    @Data
    public static class Defaults {
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double buyThreshold = 65.0;
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double sellThreshold = 65.0;
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double addPositionThreshold = 75.0;
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double closePositionThreshold = 40.0;
        @DecimalMin("0.0") @DecimalMax("100.0")
        private double closeAllThreshold = 20.0;
        private Duration cooldown = Duration.ofMinutes(5);
        @Min(1)
        private int maxPositions = 3;
        @Positive
        private double riskPercent = 1.0;

        public InstrumentConfig toConfig(String symbol) {
            return InstrumentConfig.builder()
                    .symbol(symbol)
                    .buyThreshold(buyThreshold)
                    .sellThreshold(sellThreshold)
                    .addPositionThreshold(addPositionThreshold)
                    .closePositionThreshold(closePositionThreshold)
                    .closeAllThreshold(closeAllThreshold)
                    .cooldown(cooldown)
                    .maxPositions(maxPositions)
                    .riskPercent(riskPercent)
                    .build();
        }
    }

    /**
     * Start-up registration entry; unset fields fall back to {@link Defaults}.
     */
    @Data
    public static class Instrument {
        @NotBlank
        private String symbol;
        private Double buyThreshold;
        private Double sellThreshold;
        private Double addPositionThreshold;
        private Double closePositionThreshold;
        private Double closeAllThreshold;
        private Duration cooldown;
        private Integer maxPositions;
        private Double riskPercent;

        public InstrumentConfig toConfig(Defaults defaults) {
            InstrumentConfig base = defaults.toConfig(symbol);
            return base.toBuilder()
                    .buyThreshold(buyThreshold != null ? buyThreshold : base.getBuyThreshold())
                    .sellThreshold(sellThreshold != null ? sellThreshold : base.getSellThreshold())
                    .addPositionThreshold(addPositionThreshold != null ? addPositionThreshold : base.getAddPositionThreshold())
                    .closePositionThreshold(closePositionThreshold != null ? closePositionThreshold : base.getClosePositionThreshold())
                    .closeAllThreshold(closeAllThreshold != null ? closeAllThreshold : base.getCloseAllThreshold())
                    .cooldown(cooldown != null ? cooldown : base.getCooldown())
                    .maxPositions(maxPositions != null ? maxPositions : base.getMaxPositions())
                    .riskPercent(riskPercent != null ? riskPercent : base.getRiskPercent())
                    .build();
        }
    }

    @Data
    public static class Execution {
        private Paper paper = new Paper();

        @Data
        public static class Paper {
            private boolean enabled = true;
            private double lotsPerRiskPercent = 0.01;
            private int maxTotalPositions = 20;
            private boolean tradingAllowed = true;
            private double startingBalance = 100_000.0;
        }
    }

    @Data
    public static class Risk {
        private boolean enabled = true;
        private double maxDrawdownPercent = 10.0;
    }

    @Data
    public static class TradingWindow {
        private boolean enabled = false;
        private String timezone = "UTC";
        private List<String> windows = new ArrayList<>();
        private List<String> blackout = new ArrayList<>();
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
    }
}
