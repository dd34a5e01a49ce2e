package tw.gc.auto.equity.research.metrics;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Built-in regression and ranking metrics for cross-sectional return prediction.
 */
public enum StandardMetric implements MetricFunction {

    MSE("mse", false) {
        @Override
        public double compute(double[] actual, double[] predicted) {
            if (actual.length == 0) return Double.NaN;
            double sum = 0;
            for (int i = 0; i < actual.length; i++) {
                double d = predicted[i] - actual[i];
                sum += d * d;
            }
            return sum / actual.length;
        }
    },

    MAE("mae", false) {
        @Override
        public double compute(double[] actual, double[] predicted) {
            if (actual.length == 0) return Double.NaN;
            double sum = 0;
            for (int i = 0; i < actual.length; i++) {
                sum += Math.abs(predicted[i] - actual[i]);
            }
            return sum / actual.length;
        }
    },

    /** Pearson correlation between predictions and targets. */
    INFORMATION_COEFFICIENT("ic", true) {
        @Override
        public double compute(double[] actual, double[] predicted) {
            return pearson(actual, predicted);
        }
    },

    /** Spearman rank correlation between predictions and targets. */
    RANK_INFORMATION_COEFFICIENT("rank_ic", true) {
        @Override
        public double compute(double[] actual, double[] predicted) {
            return pearson(ranks(actual), ranks(predicted));
        }
    },

    /** Share of rows where prediction and target have the same sign. */
    HIT_RATE("hit_rate", true) {
        @Override
        public double compute(double[] actual, double[] predicted) {
            if (actual.length == 0) return Double.NaN;
            int hits = 0;
            for (int i = 0; i < actual.length; i++) {
                if (Math.signum(actual[i]) == Math.signum(predicted[i])) {
                    hits++;
                }
            }
            return (double) hits / actual.length;
        }
    };

    private final String metricName;
    private final boolean higherIsBetter;

    StandardMetric(String metricName, boolean higherIsBetter) {
        this.metricName = metricName;
        this.higherIsBetter = higherIsBetter;
    }

    @Override
    public String metricName() {
        return metricName;
    }

    @Override
    public boolean higherIsBetter() {
        return higherIsBetter;
    }

    static double pearson(double[] a, double[] b) {
        int n = a.length;
        if (n < 2) return Double.NaN;
        double meanA = 0;
        double meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a[i];
            meanB += b[i];
        }
        meanA /= n;
        meanB /= n;
        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }
        if (varA == 0 || varB == 0) return Double.NaN;
        return cov / Math.sqrt(varA * varB);
    }

    /** Average ranks (1-based), ties share the mean rank. */
    static double[] ranks(double[] values) {
        int n = values.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && values[order[j + 1]] == values[order[i]]) {
                j++;
            }
            double rank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = rank;
            }
            i = j + 1;
        }
        return ranks;
    }
}
