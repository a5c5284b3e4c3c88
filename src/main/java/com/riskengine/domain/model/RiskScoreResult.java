package com.riskengine.domain.model;

import com.riskengine.domain.enums.RiskCategory;
import com.riskengine.domain.enums.ScoreComponent;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Bounded 0-100 score derived deterministically from a {@link RiskAnalysisResult}. Higher is
 * safer.
 */
@Value
@Builder
public class RiskScoreResult {

    double overallScore;
    Map<ScoreComponent, Double> subScores;
    RiskCategory category;
    List<String> recommendations;
    String interpretation;

    public double subScore(ScoreComponent component) {
        return subScores.get(component);
    }
}
