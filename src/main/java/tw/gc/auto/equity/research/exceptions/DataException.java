package tw.gc.auto.equity.research.exceptions;

/**
 * A window's training or validation slice is empty or malformed.
 */
public class DataException extends ModelResearchException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
