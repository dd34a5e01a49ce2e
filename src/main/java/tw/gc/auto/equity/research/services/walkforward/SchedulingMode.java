package tw.gc.auto.equity.research.services.walkforward;

/**
 * How the training range moves from one window to the next.
 */
public enum SchedulingMode {
    /** Fixed-size training range sliding forward by the step size. */
    ROLLING,
    /** Training range anchored at the first time point, growing by the step size. */
    EXPANDING
}
