package tw.gc.auto.equity.research.models;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.equity.research.dataset.DatasetRow;

/**
 * Predicts the training-target mean. With {@code per_entity = 1} it predicts each entity's own
 * mean and falls back to the global mean for entities unseen during training.
 */
@Slf4j
public class BaselineAdapter implements ModelAdapter {

    public static final String PER_ENTITY = "per_entity";

    /** Trained state. */
    public record State(double globalMean, Map<String, Double> entityMeans) {
        public State {
            entityMeans = entityMeans == null ? Map.of() : new TreeMap<>(entityMeans);
        }
    }

    private AdapterSupport.FitContext context;
    private State state;

    public BaselineAdapter() {
    }

    BaselineAdapter(AdapterSupport.FitContext context, State state) {
        this.context = context;
        this.state = state;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.BASELINE;
    }

    @Override
    public int minimumTrainingRows(AdapterConfig config) {
        return 1;
    }

    @Override
    public double predictionTolerance() {
        return 0.0;
    }

    @Override
    public void fit(List<DatasetRow> trainingRows, String targetColumn, AdapterConfig config) {
        AdapterSupport.TrainingData data = AdapterSupport.prepareFit(this, trainingRows, targetColumn, config);
        double[] y = data.targets();

        double sum = 0;
        for (double v : y) {
            sum += v;
        }
        double globalMean = sum / y.length;

        Map<String, Double> entityMeans = new TreeMap<>();
        if (config.flag(PER_ENTITY)) {
            Map<String, double[]> acc = new TreeMap<>();
            for (int i = 0; i < y.length; i++) {
                double[] a = acc.computeIfAbsent(trainingRows.get(i).entity(), k -> new double[2]);
                a[0] += y[i];
                a[1] += 1;
            }
            acc.forEach((entity, a) -> entityMeans.put(entity, a[0] / a[1]));
        }

        this.state = new State(globalMean, entityMeans);
        this.context = new AdapterSupport.FitContext(data.schema(), targetColumn, config);
        log.debug("Baseline fitted on {} rows: mean={}, entities={}", y.length, globalMean, entityMeans.size());
    }

    @Override
    public double[] predict(List<DatasetRow> rows) {
        AdapterSupport.preparePredict(this, context, rows);
        double[] scores = new double[rows.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = state.entityMeans().getOrDefault(rows.get(i).entity(), state.globalMean());
        }
        return scores;
    }

    @Override
    public byte[] serialize() {
        return AdapterSupport.encode(family(), context, state);
    }

    @Override
    public boolean isFitted() {
        return state != null;
    }

    @Override
    public FeatureSchema featureSchema() {
        return context == null ? new FeatureSchema(List.of()) : context.schema();
    }

    @Override
    public Map<String, Object> describe() {
        return AdapterSupport.describe(family(), context);
    }
}
