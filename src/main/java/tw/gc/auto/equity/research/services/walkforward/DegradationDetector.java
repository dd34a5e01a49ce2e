package tw.gc.auto.equity.research.services.walkforward;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.equity.research.metrics.MetricFunction;

/**
 * Flags metrics that get strictly worse window after window.
 *
 * <p>A streak is a sequence of consecutive window indices, all SUCCEEDED with a finite metric
 * value, each strictly worse than the previous. A failed window or an undefined value ends the
 * streak. A metric is flagged when any streak reaches {@code minWindows} windows. The result is
 * advisory; it never stops a run.
 */
@Component
@Slf4j
public class DegradationDetector {

    public DegradationAnalysis analyze(List<TrainingRun> runs, List<? extends MetricFunction> metrics, int minWindows) {
        int threshold = Math.max(2, minWindows);
        List<String> degrading = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (MetricFunction metric : metrics) {
            int longest = longestWorseningStreak(runs, metric);
            if (longest >= threshold) {
                degrading.add(metric.metricName());
                warnings.add("Warning: '%s' worsened across %d consecutive windows"
                    .formatted(metric.metricName(), longest));
            }
        }

        if (!degrading.isEmpty()) {
            log.warn("📉 Monotonic degradation detected in {}", degrading);
        }
        return new DegradationAnalysis(degrading, warnings);
    }

    static int longestWorseningStreak(List<TrainingRun> runs, MetricFunction metric) {
        int longest = 0;
        int streak = 0;
        TrainingRun previous = null;
        for (TrainingRun run : runs) {
            double value = run.metric(metric.metricName());
            if (!run.isSucceeded() || !Double.isFinite(value)) {
                streak = 0;
                previous = null;
                continue;
            }
            boolean adjacent = previous != null
                && run.window().windowIndex() == previous.window().windowIndex() + 1;
            if (adjacent && metric.isWorse(value, previous.metric(metric.metricName()))) {
                streak++;
            } else {
                streak = 1;
            }
            longest = Math.max(longest, streak);
            previous = run;
        }
        return longest;
    }

    /**
     * @param degradingMetrics names of flagged metrics
     * @param warnings         human-readable warnings
     */
    public record DegradationAnalysis(List<String> degradingMetrics, List<String> warnings) {
        public DegradationAnalysis {
            degradingMetrics = List.copyOf(degradingMetrics);
            warnings = List.copyOf(warnings);
        }

        public boolean isDegrading() {
            return !degradingMetrics.isEmpty();
        }
    }
}
