package tw.gc.auto.equity.research.services.walkforward;

/**
 * Advisory flags on a walk-forward summary. None of them stops a run.
 */
public enum SummaryWarning {
    /** Consecutive validation ranges overlap; aggregate statistics are not independent. */
    VALIDATION_OVERLAP,
    /** At least one metric worsened across consecutive windows. */
    MONOTONIC_DEGRADATION,
    /** The dataset was too short for a single window. */
    NO_WINDOWS,
    /** Windows were scheduled but every one of them failed. */
    NO_SUCCESSFUL_WINDOWS
}
