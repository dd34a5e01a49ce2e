package tw.gc.auto.equity.research.services.walkforward;

public enum RunStatus {
    SUCCEEDED,
    FAILED
}
