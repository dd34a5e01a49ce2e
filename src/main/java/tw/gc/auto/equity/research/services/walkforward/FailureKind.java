package tw.gc.auto.equity.research.services.walkforward;

import tw.gc.auto.equity.research.exceptions.DataException;
import tw.gc.auto.equity.research.exceptions.InferenceException;
import tw.gc.auto.equity.research.exceptions.TrainingException;
import tw.gc.auto.equity.research.exceptions.WindowTimeoutException;

/**
 * Why a window's training run failed.
 */
public enum FailureKind {
    /** Training or validation slice empty or malformed. */
    DATA,
    /** Adapter fit failed. */
    TRAINING,
    /** Adapter predict failed, usually a feature-schema mismatch. */
    INFERENCE,
    /** Fit + predict exceeded the window timeout. */
    TIMEOUT,
    /** Anything else raised while evaluating the window (metric or serialization errors). */
    UNEXPECTED;

    public static FailureKind classify(Throwable error) {
        if (error instanceof DataException) return DATA;
        if (error instanceof TrainingException) return TRAINING;
        if (error instanceof InferenceException) return INFERENCE;
        if (error instanceof WindowTimeoutException) return TIMEOUT;
        return UNEXPECTED;
    }
}
