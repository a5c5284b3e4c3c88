package com.riskengine.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.riskengine.domain.model.ScenarioChange;
import com.riskengine.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ScenarioChange: shift-string parsing and applying shifts or replacement
 * weights to a current weight vector.
 */
class ScenarioChangeTest {

    private static Map<String, Double> current() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("AAPL", 0.6);
        weights.put("SGOV", 0.4);
        return weights;
    }

    // ==============================
    // PARSING
    // ==============================

    @Nested
    @DisplayName("Shift Parsing")
    class Parsing {

        @Test
        @DisplayName("Basis points, percentages and decimals convert to decimal weight changes")
        void supportedUnits() {
            assertThat(ScenarioChange.parseShift("+200bp")).isCloseTo(0.02, within(1e-15));
            assertThat(ScenarioChange.parseShift("-75bps")).isCloseTo(-0.0075, within(1e-15));
            assertThat(ScenarioChange.parseShift(" 1.5 % ")).isCloseTo(0.015, within(1e-15));
            assertThat(ScenarioChange.parseShift("-0.01")).isCloseTo(-0.01, within(1e-15));
        }

        @Test
        @DisplayName("Inline pairs are keyed by upper-cased ticker")
        void inlinePairs() {
            ScenarioChange change = ScenarioChange.parseShifts("tilt", "aapl:+500bp, sgov:-5%");

            assertThat(change.isReplacement()).isFalse();
            assertThat(change.getWeightShifts()).containsOnlyKeys("AAPL", "SGOV");
            assertThat(change.getWeightShifts().get("AAPL")).isCloseTo(0.05, within(1e-15));
            assertThat(change.getWeightShifts().get("SGOV")).isCloseTo(-0.05, within(1e-15));
        }

        @Test
        @DisplayName("Unreadable shift or pair is a configuration error")
        void malformed_rejected() {
            assertThatThrownBy(() -> ScenarioChange.parseShift("lots"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("lots");
            assertThatThrownBy(() -> ScenarioChange.parseShifts("bad", "AAPL+200bp"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> ScenarioChange.parseShifts("empty", " "))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    // ==============================
    // APPLICATION
    // ==============================

    @Nested
    @DisplayName("Application")
    class Application {

        @Test
        @DisplayName("Shifts add to current weights and new tickers start from zero")
        void shifts_applied() {
            Map<String, Double> weights = ScenarioChange.shiftWeights("tilt", Map.of("AAPL", -0.1, "MSFT", 0.1))
                    .applyTo(current());

            assertThat(weights).containsOnlyKeys("AAPL", "SGOV", "MSFT");
            assertThat(weights.get("AAPL")).isCloseTo(0.5, within(1e-12));
            assertThat(weights.get("SGOV")).isCloseTo(0.4, within(1e-12));
            assertThat(weights.get("MSFT")).isCloseTo(0.1, within(1e-12));
        }

        @Test
        @DisplayName("Shifts that do not net to zero are renormalized to a fully invested portfolio")
        void unbalancedShifts_renormalized() {
            Map<String, Double> weights =
                    ScenarioChange.shiftWeights("add", Map.of("AAPL", 0.2)).applyTo(current());

            assertThat(weights.get("AAPL")).isCloseTo(0.8 / 1.2, within(1e-12));
            assertThat(weights.get("SGOV")).isCloseTo(0.4 / 1.2, within(1e-12));
        }

        @Test
        @DisplayName("Replacement ignores current weights and normalizes the new ones")
        void replacement_normalized() {
            Map<String, Double> weights =
                    ScenarioChange.replaceWeights("swap", Map.of("msft", 3.0, "SGOV", 1.0)).applyTo(current());

            assertThat(weights).containsOnlyKeys("MSFT", "SGOV");
            assertThat(weights.get("MSFT")).isCloseTo(0.75, within(1e-12));
        }

        @Test
        @DisplayName("Net-short result is normalized by gross weight")
        void netShort_grossNormalized() {
            Map<String, Double> weights =
                    ScenarioChange.replaceWeights("short", Map.of("AAPL", 0.3, "TSLA", -0.4)).applyTo(current());

            assertThat(weights.get("AAPL")).isCloseTo(0.3 / 0.7, within(1e-12));
            assertThat(weights.get("TSLA")).isCloseTo(-0.4 / 0.7, within(1e-12));
        }

        @Test
        @DisplayName("Change that removes every exposure is a configuration error")
        void noExposure_rejected() {
            ScenarioChange change = ScenarioChange.shiftWeights("flatten", Map.of("AAPL", -0.6, "SGOV", -0.4));

            assertThatThrownBy(() -> change.applyTo(current()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("no exposure");
        }

        @Test
        @DisplayName("Non-finite weights are rejected and applied weights are read-only")
        void validation() {
            assertThatThrownBy(() -> ScenarioChange.replaceWeights("nan", Map.of("AAPL", Double.NaN)))
                    .isInstanceOf(ConfigurationException.class);
            Map<String, Double> weights =
                    ScenarioChange.shiftWeights("tilt", Map.of("AAPL", 0.0)).applyTo(current());

            assertThatThrownBy(() -> weights.put("AAPL", 1.0)).isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
