package tw.gc.auto.equity.research.exceptions;

/**
 * Invalid walk-forward or scheduler configuration. Raised before any window is processed.
 */
public class ConfigurationException extends ModelResearchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
