package tw.gc.auto.equity.research.metrics;

/**
 * Cross-window statistics of one metric.
 *
 * @param metricName       metric key
 * @param higherIsBetter   direction of the metric
 * @param count            windows contributing a finite value
 * @param mean             mean over those windows
 * @param stdDev           population standard deviation
 * @param worst            minimum for higher-is-better metrics, maximum otherwise
 * @param worstWindowIndex window holding the worst value, -1 when {@code count == 0}
 */
public record MetricStatistics(
    String metricName,
    boolean higherIsBetter,
    int count,
    double mean,
    double stdDev,
    double worst,
    int worstWindowIndex
) {

    public static MetricStatistics empty(MetricFunction metric) {
        return new MetricStatistics(metric.metricName(), metric.higherIsBetter(), 0,
            Double.NaN, Double.NaN, Double.NaN, -1);
    }

    /**
     * @param values       per-window values in window order; non-finite values are skipped
     * @param windowIndices window index of each value
     */
    public static MetricStatistics of(MetricFunction metric, double[] values, int[] windowIndices) {
        int count = 0;
        double sum = 0;
        double worst = Double.NaN;
        int worstWindow = -1;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!Double.isFinite(v)) continue;
            count++;
            sum += v;
            if (worstWindow < 0 || metric.isWorse(v, worst)) {
                worst = v;
                worstWindow = windowIndices[i];
            }
        }
        if (count == 0) {
            return empty(metric);
        }
        double mean = sum / count;
        double squares = 0;
        for (double v : values) {
            if (!Double.isFinite(v)) continue;
            squares += (v - mean) * (v - mean);
        }
        double stdDev = Math.sqrt(squares / count);
        return new MetricStatistics(metric.metricName(), metric.higherIsBetter(), count, mean, stdDev, worst, worstWindow);
    }
}
