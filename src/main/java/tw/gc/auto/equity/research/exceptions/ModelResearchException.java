package tw.gc.auto.equity.research.exceptions;

/**
 * Root of the unchecked exceptions raised by the walk-forward engine and the artifact registry.
 */
public class ModelResearchException extends RuntimeException {

    public ModelResearchException(String message) {
        super(message);
    }

    public ModelResearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
