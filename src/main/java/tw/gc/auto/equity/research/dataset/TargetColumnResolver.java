package tw.gc.auto.equity.research.dataset;

import tw.gc.auto.equity.research.exceptions.ConfigurationException;

/**
 * Chooses the target column for a training run. The engine is agnostic to how the target
 * (and its horizon) was generated; the caller decides.
 */
@FunctionalInterface
public interface TargetColumnResolver {

    String resolve(FeatureDataset dataset);

    static TargetColumnResolver fixed(String column) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Target column must be non-blank");
        }
        return dataset -> column;
    }
}
