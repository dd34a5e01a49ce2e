package tw.gc.auto.equity.research.exceptions;

/**
 * A model adapter could not score its input, typically because the feature columns differ from the fit-time set.
 */
public class InferenceException extends ModelResearchException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
