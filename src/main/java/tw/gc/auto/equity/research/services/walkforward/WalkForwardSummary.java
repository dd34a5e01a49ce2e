package tw.gc.auto.equity.research.services.walkforward;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import tw.gc.auto.equity.research.metrics.MetricStatistics;

/**
 * Result of a walk-forward run: every window with its status, cross-window metric statistics
 * over succeeded windows, and advisory warnings.
 */
public record WalkForwardSummary(
    String artifactFamily,
    String schemaVersion,
    String targetColumn,
    WindowSchedulerConfig schedulerConfig,
    List<TrainingRun> runs,
    Map<String, MetricStatistics> metricStatistics,
    Set<SummaryWarning> warnings,
    List<String> warningMessages,
    List<String> degradingMetrics,
    long totalDurationMs
) {
    public WalkForwardSummary {
        runs = List.copyOf(runs);
        metricStatistics = Collections.unmodifiableSortedMap(new TreeMap<>(metricStatistics));
        warnings = warnings.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(SummaryWarning.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(warnings));
        warningMessages = List.copyOf(warningMessages);
        degradingMetrics = List.copyOf(degradingMetrics);
    }

    public int totalWindows() {
        return runs.size();
    }

    public int succeededWindows() {
        return (int) runs.stream().filter(TrainingRun::isSucceeded).count();
    }

    public int failedWindows() {
        return totalWindows() - succeededWindows();
    }

    public boolean hasWarning(SummaryWarning warning) {
        return warnings.contains(warning);
    }

    public boolean degradationWarning() {
        return hasWarning(SummaryWarning.MONOTONIC_DEGRADATION);
    }

    public List<TrainingRun> failedRuns() {
        return runs.stream().filter(r -> !r.isSucceeded()).toList();
    }

    /**
     * Out-of-sample scores of all succeeded windows, in window order.
     */
    public List<ScoredPrediction> predictions() {
        return runs.stream()
            .filter(TrainingRun::isSucceeded)
            .flatMap(r -> r.predictions().stream())
            .toList();
    }

    public String generateReport() {
        String metricsBlock = metricStatistics.isEmpty()
            ? "  None"
            : metricStatistics.values().stream()
                .map(s -> "  • %-10s mean %.6f | std %.6f | worst %.6f (window %d) | n=%d"
                    .formatted(s.metricName(), s.mean(), s.stdDev(), s.worst(), s.worstWindowIndex(), s.count()))
                .collect(Collectors.joining("\n"));
        String windowsBlock = runs.isEmpty()
            ? "  None"
            : runs.stream().map(r -> "  " + r.summarize()).collect(Collectors.joining("\n"));
        return """
            ═══════════════════════════════════════════════════════════════
            Walk-Forward Training Report: %s (schema %s, target %s)
            ═══════════════════════════════════════════════════════════════

            Windows: %d total | %d succeeded | %d failed | %dms

            Metrics (succeeded windows):
            %s

            Windows:
            %s

            Warnings: %s
            %s
            ═══════════════════════════════════════════════════════════════
            """.formatted(
                artifactFamily, schemaVersion, targetColumn,
                totalWindows(), succeededWindows(), failedWindows(), totalDurationMs,
                metricsBlock,
                windowsBlock,
                warnings.isEmpty() ? "None" : warnings,
                warningMessages.isEmpty() ? "" : "  • " + String.join("\n  • ", warningMessages));
    }
}
