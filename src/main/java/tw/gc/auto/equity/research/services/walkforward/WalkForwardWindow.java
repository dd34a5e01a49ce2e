package tw.gc.auto.equity.research.services.walkforward;

/**
 * A single walk-forward window: a training range followed, after an optional embargo gap, by a
 * validation range.
 *
 * <pre>
 * ┌──────────────────────┬─────────┬──────────────┐
 * │  Training [ts, te)   │ embargo │ Val [vs, ve) │
 * └──────────────────────┴─────────┴──────────────┘
 * </pre>
 *
 * <p>Bounds are positions in the dataset's time index and are half-open.
 *
 * @param windowIndex zero-based index of this window in the sequence
 * @param trainStart  first training position, inclusive
 * @param trainEnd    last training position, exclusive
 * @param valStart    first validation position, inclusive
 * @param valEnd      last validation position, exclusive
 */
public record WalkForwardWindow(
    int windowIndex,
    int trainStart,
    int trainEnd,
    int valStart,
    int valEnd
) {
    public WalkForwardWindow {
        if (windowIndex < 0) {
            throw new IllegalArgumentException("windowIndex must be non-negative, got: %d".formatted(windowIndex));
        }
        if (trainStart < 0) {
            throw new IllegalArgumentException("trainStart must be non-negative, got: %d".formatted(trainStart));
        }
        if (trainStart >= trainEnd) {
            throw new IllegalArgumentException("trainStart (%d) must be before trainEnd (%d)"
                .formatted(trainStart, trainEnd));
        }
        if (trainEnd > valStart) {
            throw new IllegalArgumentException("trainEnd (%d) must be before or equal to valStart (%d)"
                .formatted(trainEnd, valStart));
        }
        if (valStart >= valEnd) {
            throw new IllegalArgumentException("valStart (%d) must be before valEnd (%d)"
                .formatted(valStart, valEnd));
        }
    }

    public int trainSize() {
        return trainEnd - trainStart;
    }

    public int valSize() {
        return valEnd - valStart;
    }

    /**
     * Number of time points between the end of training and the start of validation.
     */
    public int gap() {
        return valStart - trainEnd;
    }

    public boolean validationOverlaps(WalkForwardWindow other) {
        return valStart < other.valEnd && other.valStart < valEnd;
    }

    public String describe() {
        return "Window %d: Train [%d, %d) (%d points) | Gap %d | Val [%d, %d) (%d points)"
            .formatted(windowIndex, trainStart, trainEnd, trainSize(), gap(), valStart, valEnd, valSize());
    }
}
