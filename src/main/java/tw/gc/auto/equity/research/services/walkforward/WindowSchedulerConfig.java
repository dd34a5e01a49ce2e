package tw.gc.auto.equity.research.services.walkforward;

import tw.gc.auto.equity.research.exceptions.ConfigurationException;

/**
 * Window scheduling parameters. All sizes count time points, not calendar days.
 *
 * @param trainSize size of the training range (initial size in expanding mode)
 * @param valSize   size of the validation range
 * @param stepSize  distance between consecutive windows
 * @param embargo   minimum gap between training end and validation start
 * @param mode      rolling or expanding training range
 */
public record WindowSchedulerConfig(
    int trainSize,
    int valSize,
    int stepSize,
    int embargo,
    SchedulingMode mode
) {
    public WindowSchedulerConfig {
        if (trainSize <= 0) {
            throw new ConfigurationException("trainSize must be > 0, got: " + trainSize);
        }
        if (valSize <= 0) {
            throw new ConfigurationException("valSize must be > 0, got: " + valSize);
        }
        if (stepSize <= 0) {
            throw new ConfigurationException("stepSize must be > 0, got: " + stepSize);
        }
        if (embargo < 0) {
            throw new ConfigurationException("embargo must be >= 0, got: " + embargo);
        }
        if (mode == null) {
            throw new ConfigurationException("mode must be non-null");
        }
    }

    public static WindowSchedulerConfig rolling(int trainSize, int valSize, int stepSize, int embargo) {
        return new WindowSchedulerConfig(trainSize, valSize, stepSize, embargo, SchedulingMode.ROLLING);
    }

    public static WindowSchedulerConfig expanding(int trainSize, int valSize, int stepSize, int embargo) {
        return new WindowSchedulerConfig(trainSize, valSize, stepSize, embargo, SchedulingMode.EXPANDING);
    }

    /**
     * Time points needed for the first window to fit.
     */
    public int minimumLength() {
        return trainSize + embargo + valSize;
    }

    /**
     * Consecutive validation ranges overlap when the windows advance by less than one
     * validation range.
     */
    public boolean hasOverlappingValidation() {
        return stepSize < valSize;
    }
}
