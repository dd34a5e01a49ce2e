package tw.gc.auto.equity.research.models;

/**
 * Builds one fresh, unfitted {@link ModelAdapter} per walk-forward window.
 */
@FunctionalInterface
public interface ModelAdapterFactory {

    ModelAdapter create();
}
