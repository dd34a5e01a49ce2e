package tw.gc.auto.equity.research.models;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import smile.base.cart.Loss;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.math.MathEx;
import smile.regression.GradientTreeBoost;
import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.exceptions.TrainingException;

/**
 * Tree-ensemble variant: Smile's least-squares {@link GradientTreeBoost} over the feature columns.
 *
 * <p>Hyperparameters (defaults in brackets): {@code n_estimators} [100], {@code learning_rate}
 * [0.05], {@code max_depth} [3], {@code max_nodes} [8], {@code min_rows_per_leaf} [5],
 * {@code subsample} [0.8]. Smile draws its row subsamples from the calling thread's generator,
 * which is reseeded with {@link AdapterConfig#seed()} right before every fit.
 */
@Slf4j
public class GradientBoostedTreesAdapter implements ModelAdapter {

    public static final String N_ESTIMATORS = "n_estimators";
    public static final String LEARNING_RATE = "learning_rate";
    public static final String MAX_DEPTH = "max_depth";
    public static final String MAX_NODES = "max_nodes";
    public static final String MIN_ROWS_PER_LEAF = "min_rows_per_leaf";
    public static final String SUBSAMPLE = "subsample";

    static final int MIN_TRAINING_ROWS = 20;

    /**
     * Trained state: the Java-serialized Smile model. Jackson writes the bytes as base64.
     */
    public record State(int trees, byte[] model) {
    }

    private AdapterSupport.FitContext context;
    private State state;
    private GradientTreeBoost model;

    public GradientBoostedTreesAdapter() {
    }

    GradientBoostedTreesAdapter(AdapterSupport.FitContext context, State state) {
        this.context = context;
        this.state = state;
        this.model = readModel(state.model());
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.TREE_ENSEMBLE;
    }

    @Override
    public int minimumTrainingRows(AdapterConfig config) {
        return Math.max(MIN_TRAINING_ROWS, 2 * config.intHyperparameter(MIN_ROWS_PER_LEAF, 5));
    }

    @Override
    public double predictionTolerance() {
        return 0.0;
    }

    @Override
    public void fit(List<DatasetRow> trainingRows, String targetColumn, AdapterConfig config) {
        AdapterSupport.TrainingData data = AdapterSupport.prepareFit(this, trainingRows, targetColumn, config);
        AdapterSupport.checkInterrupted(family());

        int estimators = Math.max(1, config.intHyperparameter(N_ESTIMATORS, 100));
        double learningRate = config.hyperparameter(LEARNING_RATE, 0.05);
        int maxDepth = Math.max(2, config.intHyperparameter(MAX_DEPTH, 3));
        int maxNodes = Math.max(2, config.intHyperparameter(MAX_NODES, 8));
        int minLeaf = Math.max(1, config.intHyperparameter(MIN_ROWS_PER_LEAF, 5));
        double subsample = Math.min(1.0, config.hyperparameter(SUBSAMPLE, 0.8));

        DataFrame frame = frame(data.schema(), targetColumn, data.features(), data.targets());
        GradientTreeBoost fitted;
        try {
            MathEx.setSeed(config.seed());
            fitted = GradientTreeBoost.fit(Formula.lhs(targetColumn), frame, Loss.ls(),
                estimators, maxDepth, maxNodes, minLeaf, learningRate, subsample);
        } catch (IllegalArgumentException e) {
            throw new TrainingException("Tree ensemble rejected its configuration: " + e.getMessage(), e);
        }

        this.model = fitted;
        this.state = new State(fitted.trees().length, writeModel(fitted));
        this.context = new AdapterSupport.FitContext(data.schema(), targetColumn, config);
        log.debug("Tree ensemble fitted: {} rows, {} features, {} trees",
            data.targets().length, data.schema().size(), state.trees());
    }

    @Override
    public double[] predict(List<DatasetRow> rows) {
        double[][] x = AdapterSupport.preparePredict(this, context, rows);
        if (x.length == 0) {
            return new double[0];
        }
        // The formula binds the response column, so scoring frames carry a placeholder target.
        DataFrame frame = frame(context.schema(), context.targetColumn(), x, new double[x.length]);
        double[] scores = new double[x.length];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = model.predict(frame.get(i));
        }
        return scores;
    }

    private static DataFrame frame(FeatureSchema schema, String targetColumn, double[][] x, double[] y) {
        List<String> features = schema.columns();
        String[] names = new String[features.size() + 1];
        for (int j = 0; j < features.size(); j++) {
            names[j] = features.get(j);
        }
        names[features.size()] = targetColumn;

        double[][] data = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            double[] row = new double[names.length];
            System.arraycopy(x[i], 0, row, 0, x[i].length);
            row[names.length - 1] = y[i];
            data[i] = row;
        }
        return DataFrame.of(data, names);
    }

    private static byte[] writeModel(GradientTreeBoost model) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(model);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write tree ensemble", e);
        }
        return bytes.toByteArray();
    }

    private static GradientTreeBoost readModel(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("Tree ensemble state carries no model");
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            return (GradientTreeBoost) in.readObject();
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new IllegalArgumentException("Corrupt tree ensemble model", e);
        }
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
        Map<String, Object> meta = AdapterSupport.describe(family(), context);
        if (state != null) {
            meta.put("trees", state.trees());
        }
        return meta;
    }
}
