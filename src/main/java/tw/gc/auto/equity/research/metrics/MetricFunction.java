package tw.gc.auto.equity.research.metrics;

/**
 * Scores predictions against realized targets for one validation slice.
 */
public interface MetricFunction {

    /** Stable metric name, used as the key in metrics snapshots. */
    String metricName();

    /** Direction used to pick the worst window and to detect degradation. */
    boolean higherIsBetter();

    /**
     * @param actual    realized targets
     * @param predicted predictions aligned with {@code actual}
     * @return the metric, or {@code NaN} when undefined for this input
     */
    double compute(double[] actual, double[] predicted);

    /**
     * True when {@code candidate} is strictly worse than {@code reference}.
     */
    default boolean isWorse(double candidate, double reference) {
        return higherIsBetter() ? candidate < reference : candidate > reference;
    }
}
