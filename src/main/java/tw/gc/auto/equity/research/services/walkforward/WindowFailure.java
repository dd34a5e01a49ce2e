package tw.gc.auto.equity.research.services.walkforward;

/**
 * Recorded reason of a FAILED training run.
 *
 * @param kind    failure category
 * @param message human-readable reason
 */
public record WindowFailure(FailureKind kind, String message) {

    public WindowFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind must be non-null");
        }
        message = message == null ? kind.name() : message;
    }

    public static WindowFailure from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new WindowFailure(FailureKind.classify(error), message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
