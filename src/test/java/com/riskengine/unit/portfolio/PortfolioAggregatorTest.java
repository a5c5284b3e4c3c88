package com.riskengine.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.riskengine.domain.model.CashHolding;
import com.riskengine.domain.model.EquityHolding;
import com.riskengine.domain.model.FactorProxySet;
import com.riskengine.domain.model.Holding;
import com.riskengine.domain.model.WeightedPortfolio;
import com.riskengine.exception.ConfigurationException;
import com.riskengine.exception.DataInsufficientException;
import com.riskengine.marketdata.InMemoryMarketDataProvider;
import com.riskengine.portfolio.PortfolioAggregator;
import com.riskengine.support.MarketDataFixtures;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PortfolioAggregator covering valuation, cash proxy substitution,
 * normalization of long, levered and net-short books, and rejection of ambiguous tickers.
 */
class PortfolioAggregatorTest {

    private static final LocalDate VALUATION_DATE = LocalDate.of(2024, 12, 31);

    private InMemoryMarketDataProvider marketData;
    private PortfolioAggregator aggregator;
    private FactorProxySet proxySet;

    @BeforeEach
    void setUp() {
        marketData = new InMemoryMarketDataProvider();
        aggregator = new PortfolioAggregator(marketData);
        proxySet = MarketDataFixtures.marketOnlyProxySet();
    }

    // ==============================
    // VALUATION
    // ==============================

    @Nested
    @DisplayName("Valuation")
    class Valuation {

        @Test
        @DisplayName("Dollar holdings are weighted by their share of the total")
        void dollarHoldings_normalized() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 6000), CashHolding.of("USD", 4000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getWeights()).containsOnlyKeys("AAPL", "SGOV");
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(0.6, within(1e-12));
            assertThat(weighted.getWeights().get("SGOV")).isCloseTo(0.4, within(1e-12));
            assertThat(weighted.getTotalValue()).isEqualByComparingTo("10000");
            assertThat(weighted.getLeverage()).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Share counts use the latest price on or before the valuation date")
        void shares_valuedAtLatestPrice() {
            marketData.putPrice("MSFT", LocalDate.of(2024, 12, 20), new BigDecimal("400"));
            marketData.putPrice("MSFT", LocalDate.of(2024, 12, 27), new BigDecimal("420"));
            marketData.putPrice("MSFT", LocalDate.of(2025, 1, 3), new BigDecimal("999"));

            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofShares("MSFT", 10), EquityHolding.ofDollars("AAPL", 5800)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getExposures().get("MSFT")).isEqualByComparingTo("4200");
            assertThat(weighted.getWeights().get("MSFT")).isCloseTo(0.42, within(1e-12));
        }

        @Test
        @DisplayName("Missing price for a share holding is insufficient data")
        void missingPrice_dataInsufficient() {
            assertThatThrownBy(() -> aggregator.aggregate(
                            List.of(EquityHolding.ofShares("MSFT", 10)), proxySet, VALUATION_DATE))
                    .isInstanceOf(DataInsufficientException.class)
                    .hasMessageContaining("MSFT");
        }

        @Test
        @DisplayName("Duplicate dollar entries for one ticker are summed")
        void duplicateEntries_summed() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 3000), EquityHolding.ofDollars("AAPL", 3000),
                            EquityHolding.ofDollars("MSFT", 4000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getWeights()).hasSize(2);
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(0.6, within(1e-12));
        }
    }

    // ==============================
    // CASH MAPPING
    // ==============================

    @Nested
    @DisplayName("Cash Mapping")
    class CashMapping {

        @Test
        @DisplayName("Cash merges with an existing position in its proxy and preserves total value")
        void cashMergesWithProxyPosition() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("SGOV", 1000), CashHolding.of("USD", 2000),
                            EquityHolding.ofDollars("AAPL", 7000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getExposures().get("SGOV")).isEqualByComparingTo("3000");
            assertThat(weighted.getTotalValue()).isEqualByComparingTo("10000");
            assertThat(weighted.getWeights().values().stream().mapToDouble(Double::doubleValue).sum())
                    .isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Unmapped currency passes through as CUR:<ccy> and is reported")
        void unmappedCurrency_passesThrough() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(CashHolding.of("EUR", 2500), EquityHolding.ofDollars("AAPL", 7500)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getWeights()).containsKey("CUR:EUR");
            assertThat(weighted.getWeights().get("CUR:EUR")).isCloseTo(0.25, within(1e-12));
            assertThat(weighted.getUnmappedCurrencies()).containsExactly("EUR");
        }

        @Test
        @DisplayName("Margin debt reduces total value and raises leverage above one")
        void marginDebt_levered() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 15000), CashHolding.of("USD", -5000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getTotalValue()).isEqualByComparingTo("10000");
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(1.5, within(1e-12));
            assertThat(weighted.getWeights().get("SGOV")).isCloseTo(-0.5, within(1e-12));
            assertThat(weighted.getLeverage()).isCloseTo(2.0, within(1e-12));
            assertThat(weighted.getGrossExposure()).isEqualByComparingTo("20000");
        }
    }

    // ==============================
    // NORMALIZATION
    // ==============================

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Net-short portfolio is normalized by gross exposure and keeps position signs")
        void netShortPortfolio_normalizedByGross() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 6000), EquityHolding.ofDollars("TSLA", -8000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getTotalValue()).isEqualByComparingTo("-2000");
            assertThat(weighted.getGrossExposure()).isEqualByComparingTo("14000");
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(6000.0 / 14000.0, within(1e-12));
            assertThat(weighted.getWeights().get("TSLA")).isCloseTo(-8000.0 / 14000.0, within(1e-12));
            assertThat(weighted.getLeverage()).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Cash debt larger than the equity book is normalized by gross exposure")
        void negativeNetFromMarginDebt_normalizedByGross() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 1000), CashHolding.of("USD", -3000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(0.25, within(1e-12));
            assertThat(weighted.getWeights().get("SGOV")).isCloseTo(-0.75, within(1e-12));
        }

        @Test
        @DisplayName("Dollar-neutral book is normalized by gross exposure rather than dividing by zero")
        void zeroNetValue_normalizedByGross() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 1000), EquityHolding.ofDollars("MSFT", -1000)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getTotalValue()).isEqualByComparingTo("0");
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(0.5, within(1e-12));
            assertThat(weighted.getWeights().get("MSFT")).isCloseTo(-0.5, within(1e-12));
        }

        @Test
        @DisplayName("Portfolio with no exposure at all gets all-zero weights")
        void noExposure_zeroWeights() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 0), EquityHolding.ofDollars("MSFT", 0)),
                    proxySet,
                    VALUATION_DATE);

            assertThat(weighted.getWeights().values()).containsOnly(0.0);
            assertThat(weighted.getLeverage()).isZero();
        }
    }

    // ==============================
    // IMMUTABILITY
    // ==============================

    @Nested
    @DisplayName("Immutability")
    class Immutability {

        @Test
        @DisplayName("Weights and exposures cannot be modified by callers")
        void weightsAndExposures_unmodifiable() {
            WeightedPortfolio weighted = aggregator.aggregate(
                    List.of(EquityHolding.ofDollars("AAPL", 6000), EquityHolding.ofDollars("MSFT", 4000)),
                    proxySet,
                    VALUATION_DATE);

            assertThatThrownBy(() -> weighted.getWeights().put("AAPL", 0.1))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> weighted.getExposures().remove("MSFT"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(weighted.getWeights().get("AAPL")).isCloseTo(0.6, within(1e-12));
        }
    }

    // ==============================
    // REJECTION
    // ==============================

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("Same ticker as both shares and dollars is a configuration error")
        void conflictingQuantityTypes_rejected() {
            marketData.putPrice("AAPL", LocalDate.of(2024, 12, 31), new BigDecimal("250"));
            List<Holding> holdings = List.of(EquityHolding.ofShares("AAPL", 10), EquityHolding.ofDollars("AAPL", 500));

            assertThatThrownBy(() -> aggregator.aggregate(holdings, proxySet, VALUATION_DATE))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("AAPL");
        }
    }
}
