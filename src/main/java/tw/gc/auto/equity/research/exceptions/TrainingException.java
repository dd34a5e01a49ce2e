package tw.gc.auto.equity.research.exceptions;

/**
 * A model adapter could not be fitted.
 */
public class TrainingException extends ModelResearchException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
