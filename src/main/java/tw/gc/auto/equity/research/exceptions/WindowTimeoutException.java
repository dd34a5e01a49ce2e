package tw.gc.auto.equity.research.exceptions;

import java.time.Duration;

import lombok.Getter;

/**
 * Fit or predict for a single window did not finish within the configured timeout.
 */
@Getter
public class WindowTimeoutException extends ModelResearchException {

    private final int windowIndex;
    private final Duration timeout;

    public WindowTimeoutException(int windowIndex, Duration timeout) {
        super("Window %d exceeded timeout of %d ms".formatted(windowIndex, timeout.toMillis()));
        this.windowIndex = windowIndex;
        this.timeout = timeout;
    }
}
