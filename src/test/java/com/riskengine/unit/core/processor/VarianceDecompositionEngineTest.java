package com.riskengine.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.riskengine.config.RiskEngineProperties;
import com.riskengine.core.processor.RiskContributionCalculator;
import com.riskengine.core.processor.VarianceDecompositionEngine;
import com.riskengine.domain.model.FactorBetaMatrix;
import com.riskengine.domain.model.FactorCovariance;
import com.riskengine.domain.model.FactorExposure;
import com.riskengine.domain.model.HoldingRiskContribution;
import com.riskengine.domain.model.RiskContributions;
import com.riskengine.domain.model.VarianceDecomposition;
import com.riskengine.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for VarianceDecompositionEngine and RiskContributionCalculator against hand-computed
 * values for a two-holding, one-factor portfolio.
 *
 * <p>Σf = [0.04]; A: beta 1.2, residual 0.02; B: beta 0.5, residual 0.01; w = (0.6, 0.4).
 * Portfolio beta 0.92, factor variance 0.033856, idiosyncratic 0.0088, total 0.042656.
 */
class VarianceDecompositionEngineTest {

    private static final List<String> MARKET_ONLY = List.of("market");

    private VarianceDecompositionEngine engine;
    private RiskContributionCalculator calculator;
    private FactorCovariance covariance;
    private Map<String, FactorExposure> exposures;

    @BeforeEach
    void setUp() {
        RiskEngineProperties properties = new RiskEngineProperties();
        engine = new VarianceDecompositionEngine(properties);
        calculator = new RiskContributionCalculator();
        covariance = new FactorCovariance(MARKET_ONLY, new double[][] {{0.04}}, new double[][] {{1.0}}, 36);
        exposures = new LinkedHashMap<>();
        exposures.put("A", exposure("A", 1.2, 0.02));
        exposures.put("B", exposure("B", 0.5, 0.01));
    }

    private static FactorExposure exposure(String ticker, double beta, double residualVariance) {
        return FactorExposure.builder()
                .ticker(ticker)
                .betas(Map.of("market", beta))
                .residualVariance(residualVariance)
                .rSquared(0.5)
                .observations(36)
                .build();
    }

    private FactorBetaMatrix betas(List<String> tickers) {
        return FactorBetaMatrix.of(tickers, MARKET_ONLY, exposures);
    }

    private static Map<String, Double> weights(double a, double b) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("A", a);
        weights.put("B", b);
        return weights;
    }

    // ==============================
    // DECOMPOSITION
    // ==============================

    @Nested
    @DisplayName("Variance Decomposition")
    class Decomposition {

        @Test
        @DisplayName("Factor and idiosyncratic parts match the closed form and sum to the total")
        void matchesClosedForm() {
            VarianceDecomposition result = engine.decompose(weights(0.6, 0.4), betas(List.of("A", "B")), covariance);

            assertThat(result.getPortfolioBetas().get("market")).isCloseTo(0.92, within(1e-12));
            assertThat(result.getFactorVariance()).isCloseTo(0.033856, within(1e-12));
            assertThat(result.getIdiosyncraticVariance()).isCloseTo(0.0088, within(1e-12));
            assertThat(result.getTotalVariance())
                    .isEqualTo(result.getFactorVariance() + result.getIdiosyncraticVariance());
            assertThat(result.getVolatility()).isCloseTo(Math.sqrt(0.042656), within(1e-12));
            assertThat(result.getHerfindahlIndex()).isCloseTo(0.52, within(1e-12));
        }

        @Test
        @DisplayName("Stressed loss is |portfolio beta| times the factor crash move")
        void stressLoss_usesCrashMove() {
            VarianceDecomposition result = engine.decompose(weights(0.6, 0.4), betas(List.of("A", "B")), covariance);

            assertThat(result.getFactorStressLosses().get("market")).isCloseTo(0.92 * 0.35, within(1e-12));
        }

        @Test
        @DisplayName("Single fully-weighted holding has no diversification benefit")
        void singleHolding_noDiversification() {
            Map<String, Double> weights = Map.of("A", 1.0);

            VarianceDecomposition result = engine.decompose(weights, betas(List.of("A")), covariance);

            assertThat(result.getIdiosyncraticVariance()).isCloseTo(0.02, within(1e-15));
            assertThat(result.getFactorVariance()).isCloseTo(1.2 * 1.2 * 0.04, within(1e-15));
        }

        @Test
        @DisplayName("All-zero weights give zero variance, not an error")
        void zeroWeights_zeroVariance() {
            VarianceDecomposition result = engine.decompose(weights(0.0, 0.0), betas(List.of("A", "B")), covariance);

            assertThat(result.getTotalVariance()).isZero();
            assertThat(result.getVolatility()).isZero();
            assertThat(result.factorShare()).isZero();
        }

        @Test
        @DisplayName("Non-finite weight is a configuration error")
        void nonFiniteWeight_rejected() {
            assertThatThrownBy(() -> engine.decompose(
                            weights(Double.NaN, 0.4), betas(List.of("A", "B")), covariance))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    // ==============================
    // CONTRIBUTIONS
    // ==============================

    @Nested
    @DisplayName("Euler Contributions")
    class Contributions {

        @Test
        @DisplayName("Holding contributions match w_i (Σw)_i and sum to total variance")
        void holdingContributions_sumToTotal() {
            FactorBetaMatrix betas = betas(List.of("A", "B"));
            VarianceDecomposition decomposition = engine.decompose(weights(0.6, 0.4), betas, covariance);

            RiskContributions contributions = calculator.calculate(weights(0.6, 0.4), betas, covariance, decomposition);

            Map<String, HoldingRiskContribution> byTicker = contributions.byTicker();
            assertThat(byTicker.get("A").getVarianceContribution()).isCloseTo(0.033696, within(1e-12));
            assertThat(byTicker.get("B").getVarianceContribution()).isCloseTo(0.00896, within(1e-12));
            double sum = contributions.getHoldings().stream()
                    .mapToDouble(HoldingRiskContribution::getVarianceContribution)
                    .sum();
            assertThat(sum).isCloseTo(decomposition.getTotalVariance(), within(1e-15));
            double volatilitySum = contributions.getHoldings().stream()
                    .mapToDouble(HoldingRiskContribution::getVolatilityContribution)
                    .sum();
            assertThat(volatilitySum).isCloseTo(decomposition.getVolatility(), within(1e-12));
        }

        @Test
        @DisplayName("Factor contributions plus the idiosyncratic bucket sum to total variance")
        void factorContributions_sumToTotal() {
            FactorBetaMatrix betas = betas(List.of("A", "B"));
            VarianceDecomposition decomposition = engine.decompose(weights(0.6, 0.4), betas, covariance);

            RiskContributions contributions = calculator.calculate(weights(0.6, 0.4), betas, covariance, decomposition);

            assertThat(contributions.getFactors()).hasSize(1);
            assertThat(contributions.getFactors().get(0).getVarianceContribution())
                    .isCloseTo(0.033856, within(1e-12));
            assertThat(contributions.factorVarianceShares().get("market") + contributions.getIdiosyncraticPercent())
                    .isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Zero total variance gives zero percentages")
        void zeroVariance_zeroPercentages() {
            FactorBetaMatrix betas = betas(List.of("A", "B"));
            VarianceDecomposition decomposition = engine.decompose(weights(0.0, 0.0), betas, covariance);

            RiskContributions contributions = calculator.calculate(weights(0.0, 0.0), betas, covariance, decomposition);

            assertThat(contributions.getHoldings())
                    .allSatisfy(holding -> assertThat(holding.getPercentOfVariance()).isZero());
            assertThat(contributions.getIdiosyncraticPercent()).isZero();
        }
    }
}
