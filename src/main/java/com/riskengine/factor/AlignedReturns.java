package com.riskengine.factor;

import com.riskengine.domain.model.ReturnSeries;
import java.time.LocalDate;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Several return series restricted to the dates they all share, as a dense observations ×
 * series matrix.
 */
final class AlignedReturns {

    private final List<LocalDate> dates;
    private final double[][] values;

    private AlignedReturns(List<LocalDate> dates, double[][] values) {
        this.dates = dates;
        this.values = values;
    }

    static AlignedReturns of(List<ReturnSeries> series) {
        NavigableSet<LocalDate> common = new TreeSet<>(series.get(0).asMap().keySet());
        for (int s = 1; s < series.size(); s++) {
            common.retainAll(series.get(s).asMap().keySet());
        }
        List<LocalDate> dates = List.copyOf(common);
        double[][] values = new double[dates.size()][series.size()];
        for (int t = 0; t < dates.size(); t++) {
            for (int s = 0; s < series.size(); s++) {
                values[t][s] = series.get(s).get(dates.get(t));
            }
        }
        return new AlignedReturns(dates, values);
    }

    int observations() {
        return dates.size();
    }

    /** Column {@code s} over all aligned dates. */
    double[] column(int s) {
        double[] column = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            column[t] = values[t][s];
        }
        return column;
    }

    /** Columns [from, to) as an observations × (to - from) matrix. */
    double[][] columns(int from, int to) {
        double[][] block = new double[values.length][to - from];
        for (int t = 0; t < values.length; t++) {
            System.arraycopy(values[t], from, block[t], 0, to - from);
        }
        return block;
    }
}
