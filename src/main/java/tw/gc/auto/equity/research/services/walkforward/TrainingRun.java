package tw.gc.auto.equity.research.services.walkforward;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of one walk-forward window. Exactly one run exists per window whether it succeeded or
 * failed.
 *
 * @param window       the window evaluated
 * @param status       SUCCEEDED or FAILED
 * @param failure      reason, present only when FAILED
 * @param metrics      validation metrics by name (empty when FAILED)
 * @param artifactRef  registry entry, present only when SUCCEEDED
 * @param startedAt    when processing of the window began
 * @param finishedAt   when the run was recorded
 * @param trainRows    labeled training rows fitted on
 * @param valRows      validation rows scored
 * @param predictions  validation scores aligned with the validation rows
 */
public record TrainingRun(
    WalkForwardWindow window,
    RunStatus status,
    WindowFailure failure,
    Map<String, Double> metrics,
    ArtifactRef artifactRef,
    Instant startedAt,
    Instant finishedAt,
    int trainRows,
    int valRows,
    List<ScoredPrediction> predictions
) {
    public TrainingRun {
        if (window == null || status == null) {
            throw new IllegalArgumentException("window and status must be non-null");
        }
        if (status == RunStatus.FAILED && failure == null) {
            throw new IllegalArgumentException("FAILED run requires a failure reason");
        }
        if (status == RunStatus.SUCCEEDED && failure != null) {
            throw new IllegalArgumentException("SUCCEEDED run cannot carry a failure");
        }
        metrics = metrics == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(metrics));
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }

    public static TrainingRun succeeded(WalkForwardWindow window, Map<String, Double> metrics, ArtifactRef artifactRef,
            Instant startedAt, Instant finishedAt, int trainRows, int valRows, List<ScoredPrediction> predictions) {
        return new TrainingRun(window, RunStatus.SUCCEEDED, null, metrics, artifactRef,
            startedAt, finishedAt, trainRows, valRows, predictions);
    }

    public static TrainingRun failed(WalkForwardWindow window, WindowFailure failure,
            Instant startedAt, Instant finishedAt) {
        return new TrainingRun(window, RunStatus.FAILED, failure, Map.of(), null,
            startedAt, finishedAt, 0, 0, List.of());
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public double metric(String name) {
        return metrics.getOrDefault(name, Double.NaN);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public String summarize() {
        if (isSucceeded()) {
            return "Window %d ✅ SUCCEEDED -> %s | metrics %s".formatted(window.windowIndex(), artifactRef, metrics);
        }
        return "Window %d ❌ FAILED (%s)".formatted(window.windowIndex(), failure);
    }
}
