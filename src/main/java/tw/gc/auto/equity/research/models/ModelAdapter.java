package tw.gc.auto.equity.research.models;

import java.util.List;
import java.util.Map;

import tw.gc.auto.equity.research.dataset.DatasetRow;

/**
 * Uniform fit/predict/serialize contract implemented by every model variant.
 *
 * <p>An instance belongs to exactly one walk-forward window: it is created fresh, fitted once,
 * asked for predictions zero or more times, serialized once and then discarded. Adapters never
 * perform I/O; persistence goes through the artifact registry.
 */
public interface ModelAdapter {

    ModelFamily family();

    /**
     * Smallest number of training rows this variant accepts under the given configuration.
     */
    int minimumTrainingRows(AdapterConfig config);

    /**
     * Largest absolute difference allowed between predictions of this instance and of an
     * instance restored from {@link #serialize()}. Zero for bit-deterministic variants.
     */
    double predictionTolerance();

    /**
     * Fits the model on the training rows.
     *
     * @throws tw.gc.auto.equity.research.exceptions.TrainingException if the rows are empty, fewer
     *         than {@link #minimumTrainingRows}, carry no feature columns, lack a declared feature or
     *         the target, or if this instance was already fitted
     */
    void fit(List<DatasetRow> trainingRows, String targetColumn, AdapterConfig config);

    /**
     * Scores the rows, one score per row in input order.
     *
     * @throws tw.gc.auto.equity.research.exceptions.InferenceException if the instance is not fitted
     *         or the rows' feature columns differ from those seen at fit time
     */
    double[] predict(List<DatasetRow> rows);

    /**
     * Opaque, deterministic payload restorable with {@link ModelAdapters#deserialize(byte[])}.
     */
    byte[] serialize();

    boolean isFitted();

    FeatureSchema featureSchema();

    /**
     * Descriptive metadata: family, feature list, target and hyperparameters.
     */
    Map<String, Object> describe();
}
