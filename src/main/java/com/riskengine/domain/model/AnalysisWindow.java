package com.riskengine.domain.model;

import com.riskengine.exception.ConfigurationException;
import java.time.LocalDate;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Inclusive date range over which returns are sampled. The end date doubles as the valuation
 * date for share-count holdings.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AnalysisWindow {

    LocalDate startDate;
    LocalDate endDate;

    public static AnalysisWindow of(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ConfigurationException("Analysis window requires both start and end dates");
        }
        if (!startDate.isBefore(endDate)) {
            throw new ConfigurationException(
                    "Analysis window start must be before end",
                    Map.of("startDate", startDate.toString(), "endDate", endDate.toString()));
        }
        return new AnalysisWindow(startDate, endDate);
    }

    @Override
    public String toString() {
        return startDate + ".." + endDate;
    }
}
