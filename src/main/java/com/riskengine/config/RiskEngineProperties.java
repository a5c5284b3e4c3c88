package com.riskengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine settings bound from application.properties under {@code riskengine.*}.
 *
 * <p>Default risk limits live separately under {@code riskengine.limits.*}; see
 * {@link RiskLimitConfig}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "riskengine")
public class RiskEngineProperties {

    @Valid
    private Model model = new Model();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Optimizer optimizer = new Optimizer();

    @Valid
    private Proxies proxies = new Proxies();

    @Data
    public static class Model {

        /** Return periods per year used to annualize variances (12 = monthly returns). */
        @Positive
        private int periodsPerYear = 12;

        /** Minimum aligned observations per regression; raised to k + 2 for k factors. */
        @Min(2)
        private int minObservations = 3;

        /** How far the first/last observation may sit from the window edges. */
        @Min(0)
        private int maxCoverageGapDays = 35;

        /** Worst-case move per factor used for stressed losses. */
        private Map<String, Double> crashScenarios = defaultCrashScenarios();

        /** Crash move for factors without an entry in {@link #crashScenarios}. */
        @Positive
        private double defaultCrashMove = 0.35;

        public double crashMoveFor(String factor) {
            Double move = crashScenarios.get(factor);
            return move != null ? Math.abs(move) : defaultCrashMove;
        }

        private static Map<String, Double> defaultCrashScenarios() {
            Map<String, Double> scenarios = new LinkedHashMap<>();
            scenarios.put("market", 0.35);
            scenarios.put("momentum", 0.50);
            scenarios.put("value", 0.40);
            scenarios.put("industry", 0.50);
            scenarios.put("subindustry", 0.50);
            return scenarios;
        }
    }

    @Data
    public static class Scoring {

        /** Volatility target when the limit set has no max volatility. */
        @Positive
        private double defaultVolatilityTarget = 0.40;

        /** Single-holding weight target when the limit set has none. */
        @Positive
        private double defaultMaxHoldingWeight = 0.40;

        /** Single-factor variance share target when the limit set has none. */
        @Positive
        private double defaultMaxFactorVarianceShare = 0.30;

        /** Worst-case move of one stock, used when suggesting a single-holding cap. */
        @Positive
        private double singleStockCrashMove = 0.80;

        /** Loss tolerance per non-market factor crash when suggesting beta caps. */
        @Positive
        private double factorLossTolerance = 0.10;
    }

    @Data
    public static class Cache {

        @NotNull
        private Duration ttl = Duration.ofMinutes(10);

        @Positive
        private long maximumSize = 100;

        /** Size of each factor-exposure cache (return series and beta rows). */
        @Positive
        private long exposureMaximumSize = 2000;
    }

    @Data
    public static class Optimizer {

        /** Projected-gradient steps allowed per optimization across all outer iterations. */
        @Positive
        private int maxIterations = 5000;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Proxies {

        private String id = "default";

        /** Factor name to proxy ticker, in factor order. */
        private Map<String, String> factors = new LinkedHashMap<>(Map.of("market", "SPY"));

        /** Factors measured as proxy return minus market return. */
        private List<String> excessFactors = new ArrayList<>();

        /** Currency to cash-equivalent proxy ticker. */
        private Map<String, String> cash = new LinkedHashMap<>(Map.of("USD", "SGOV"));
    }
}
