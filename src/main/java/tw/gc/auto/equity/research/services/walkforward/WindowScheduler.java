package tw.gc.auto.equity.research.services.walkforward;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import lombok.extern.slf4j.Slf4j;

/**
 * Lazily produces the walk-forward windows for a time index of a given length.
 *
 * <p>Window {@code i}:
 * <ul>
 *   <li>rolling: {@code trainStart = i * step}, {@code trainEnd = trainStart + trainSize}</li>
 *   <li>expanding: {@code trainStart = 0}, {@code trainEnd = trainSize + i * step}</li>
 *   <li>{@code valStart = trainEnd + embargo}, {@code valEnd = valStart + valSize}</li>
 * </ul>
 * Iteration ends at the first window whose validation range would run past the end of the
 * index; windows are never clipped. A scheduler can be iterated once.
 */
@Slf4j
public class WindowScheduler implements Iterable<WalkForwardWindow>, Iterator<WalkForwardWindow> {

    private final WindowSchedulerConfig config;
    private final int length;

    private int nextIndex;
    private WalkForwardWindow pending;
    private boolean exhausted;
    private boolean iteratorHandedOut;

    public WindowScheduler(WindowSchedulerConfig config, int length) {
        if (config == null) {
            throw new IllegalArgumentException("config must be non-null");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got: " + length);
        }
        this.config = config;
        this.length = length;
        if (length < config.minimumLength()) {
            log.warn("Insufficient data: {} time points available, {} required for one window",
                length, config.minimumLength());
        }
    }

    /**
     * Materializes every window. Intended for reporting; training iterates lazily.
     */
    public static List<WalkForwardWindow> preview(WindowSchedulerConfig config, int length) {
        List<WalkForwardWindow> windows = new ArrayList<>();
        new WindowScheduler(config, length).forEachRemaining(windows::add);
        return windows;
    }

    @Override
    public Iterator<WalkForwardWindow> iterator() {
        if (iteratorHandedOut) {
            throw new IllegalStateException("WindowScheduler can only be iterated once");
        }
        iteratorHandedOut = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        pending = compute(nextIndex);
        if (pending == null) {
            exhausted = true;
            return false;
        }
        return true;
    }

    @Override
    public WalkForwardWindow next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No further walk-forward windows");
        }
        WalkForwardWindow window = pending;
        pending = null;
        nextIndex++;
        return window;
    }

    private WalkForwardWindow compute(int index) {
        long offset = (long) index * config.stepSize();
        long trainStart;
        long trainEnd;
        if (config.mode() == SchedulingMode.EXPANDING) {
            trainStart = 0;
            trainEnd = config.trainSize() + offset;
        } else {
            trainStart = offset;
            trainEnd = trainStart + config.trainSize();
        }
        long valStart = trainEnd + config.embargo();
        long valEnd = valStart + config.valSize();
        if (valEnd > length) {
            return null;
        }
        return new WalkForwardWindow(index, (int) trainStart, (int) trainEnd, (int) valStart, (int) valEnd);
    }
}
