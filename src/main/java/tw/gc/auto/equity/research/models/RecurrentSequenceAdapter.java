package tw.gc.auto.equity.research.models;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.conf.GradientNormalization;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.indexing.NDArrayIndex;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import tw.gc.auto.equity.research.dataset.DatasetRow;

/**
 * Sequence-model variant: a single LSTM layer (DeepLearning4J) reading each entity's standardized
 * feature history, oldest first, over the last {@code lookback} rows, followed by a linear output.
 *
 * <p>Hyperparameters (defaults in brackets): {@code hidden_size} [8], {@code lookback} [5],
 * {@code epochs} [10], {@code learning_rate} [0.01], {@code gradient_clip} [1.0],
 * {@code batch_size} [32]. Mini-batches are taken in row order with Adam updates; weight
 * initialization is seeded from {@link AdapterConfig#seed()}.
 *
 * <p>History never crosses the rows handed to {@link #fit} or {@link #predict}: the first
 * validation rows of an entity see a shorter, left-padded and masked sequence rather than
 * training data.
 */
@Slf4j
public class RecurrentSequenceAdapter implements ModelAdapter {

    public static final String HIDDEN_SIZE = "hidden_size";
    public static final String LOOKBACK = "lookback";
    public static final String EPOCHS = "epochs";
    public static final String LEARNING_RATE = "learning_rate";
    public static final String GRADIENT_CLIP = "gradient_clip";
    public static final String BATCH_SIZE = "batch_size";

    static final double PREDICTION_TOLERANCE = 1e-9;

    /**
     * Trained state: scaling statistics plus the network configuration JSON and its flattened
     * parameters.
     */
    public record State(
        int lookback,
        double[] featureMean,
        double[] featureScale,
        double targetMean,
        double targetScale,
        String network,
        double[] parameters
    ) {
    }

    /** Network input of one batch of rows. */
    private record SequenceBatch(INDArray features, INDArray mask) {
    }

    private AdapterSupport.FitContext context;
    private State state;
    private MultiLayerNetwork network;

    public RecurrentSequenceAdapter() {
    }

    RecurrentSequenceAdapter(AdapterSupport.FitContext context, State state) {
        this.context = context;
        this.state = state;
        this.network = restore(state);
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.SEQUENCE_MODEL;
    }

    @Override
    public int minimumTrainingRows(AdapterConfig config) {
        return lookback(config) + 1;
    }

    static int lookback(AdapterConfig config) {
        return Math.max(1, config.intHyperparameter(LOOKBACK, 5));
    }

    @Override
    public double predictionTolerance() {
        return PREDICTION_TOLERANCE;
    }

    @Override
    public void fit(List<DatasetRow> trainingRows, String targetColumn, AdapterConfig config) {
        AdapterSupport.TrainingData data = AdapterSupport.prepareFit(this, trainingRows, targetColumn, config);
        double[][] raw = data.features();
        double[] y = data.targets();
        int n = y.length;
        int features = raw[0].length;

        int hidden = Math.max(1, config.intHyperparameter(HIDDEN_SIZE, 8));
        int lookback = lookback(config);
        int epochs = Math.max(1, config.intHyperparameter(EPOCHS, 10));
        int batchSize = Math.max(1, config.intHyperparameter(BATCH_SIZE, 32));
        double learningRate = config.hyperparameter(LEARNING_RATE, 0.01);
        double clip = config.hyperparameter(GRADIENT_CLIP, 1.0);

        double[] mean = new double[features];
        double[] scale = new double[features];
        for (int j = 0; j < features; j++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = raw[i][j];
            }
            mean[j] = mean(column);
            scale[j] = scale(column, mean[j]);
        }
        double targetMean = mean(y);
        double targetScale = scale(y, targetMean);

        SequenceBatch input = batch(standardize(raw, mean, scale), sequences(trainingRows, lookback), lookback);
        double[][] labels = new double[n][1];
        for (int i = 0; i < n; i++) {
            labels[i][0] = (y[i] - targetMean) / targetScale;
        }
        INDArray target = Nd4j.create(labels);

        MultiLayerNetwork model = new MultiLayerNetwork(configuration(features, hidden, learningRate, clip, config.seed()));
        model.init();

        for (int epoch = 0; epoch < epochs; epoch++) {
            for (int from = 0; from < n; from += batchSize) {
                AdapterSupport.checkInterrupted(family());
                int to = Math.min(n, from + batchSize);
                INDArray x = input.features()
                    .get(NDArrayIndex.interval(from, to), NDArrayIndex.all(), NDArrayIndex.all()).dup('c');
                INDArray m = input.mask().get(NDArrayIndex.interval(from, to), NDArrayIndex.all()).dup('c');
                INDArray t = target.get(NDArrayIndex.interval(from, to), NDArrayIndex.all()).dup('c');
                model.fit(new DataSet(x, t, m, null));
            }
            log.debug("Sequence model epoch {}/{}: score {}", epoch + 1, epochs, model.score());
        }

        this.network = model;
        this.state = new State(lookback, mean, scale, targetMean, targetScale,
            model.getLayerWiseConfigurations().toJson(), model.params().toDoubleVector());
        this.context = new AdapterSupport.FitContext(data.schema(), targetColumn, config);
    }

    private static MultiLayerConfiguration configuration(int features, int hidden, double learningRate,
            double clip, long seed) {
        return new NeuralNetConfiguration.Builder()
            .seed(seed)
            .dataType(DataType.DOUBLE)
            .weightInit(WeightInit.XAVIER)
            .updater(new Adam(learningRate))
            .gradientNormalization(GradientNormalization.ClipElementWiseAbsoluteValue)
            .gradientNormalizationThreshold(clip)
            .list()
            .layer(new LastTimeStep(new LSTM.Builder()
                .nIn(features)
                .nOut(hidden)
                .activation(Activation.TANH)
                .build()))
            .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                .nIn(hidden)
                .nOut(1)
                .activation(Activation.IDENTITY)
                .build())
            .setInputType(InputType.recurrent(features))
            .build();
    }

    private static MultiLayerNetwork restore(State state) {
        if (state.network() == null || state.parameters() == null) {
            throw new IllegalArgumentException("Sequence model state carries no network");
        }
        try {
            MultiLayerNetwork model = new MultiLayerNetwork(MultiLayerConfiguration.fromJson(state.network()));
            double[] parameters = state.parameters();
            model.init(Nd4j.create(parameters).reshape(1, parameters.length), true);
            return model;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Corrupt sequence model network", e);
        }
    }

    @Override
    public double[] predict(List<DatasetRow> rows) {
        double[][] raw = AdapterSupport.preparePredict(this, context, rows);
        if (raw.length == 0) {
            return new double[0];
        }
        double[][] x = standardize(raw, state.featureMean(), state.featureScale());
        SequenceBatch input = batch(x, sequences(rows, state.lookback()), state.lookback());
        INDArray output = network.output(input.features(), false, input.mask(), null);
        double[] scores = new double[rows.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = output.getDouble(i, 0) * state.targetScale() + state.targetMean();
        }
        return scores;
    }

    /**
     * For every row, the indices of the same entity's rows ending at it, oldest first, at most
     * {@code lookback} long.
     */
    static int[][] sequences(List<DatasetRow> rows, int lookback) {
        Map<String, List<Integer>> byEntity = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            byEntity.computeIfAbsent(rows.get(i).entity(), k -> new ArrayList<>()).add(i);
        }
        int[][] sequences = new int[rows.size()][];
        for (List<Integer> indices : byEntity.values()) {
            indices.sort(Comparator.<Integer, LocalDate>comparing(i -> rows.get(i).date())
                .thenComparingInt(i -> i));
            for (int p = 0; p < indices.size(); p++) {
                int from = Math.max(0, p - lookback + 1);
                int[] sequence = new int[p - from + 1];
                for (int q = from; q <= p; q++) {
                    sequence[q - from] = indices.get(q);
                }
                sequences[indices.get(p)] = sequence;
            }
        }
        return sequences;
    }

    /**
     * Packs sequences as {@code [rows, features, lookback]}, right-aligned so the last time step
     * is always the row itself. Padding steps are masked out.
     */
    private static SequenceBatch batch(double[][] x, int[][] sequences, int lookback) {
        int features = x[0].length;
        double[][][] values = new double[sequences.length][features][lookback];
        double[][] mask = new double[sequences.length][lookback];
        for (int i = 0; i < sequences.length; i++) {
            int offset = lookback - sequences[i].length;
            for (int t = 0; t < sequences[i].length; t++) {
                double[] step = x[sequences[i][t]];
                for (int j = 0; j < features; j++) {
                    values[i][j][offset + t] = step[j];
                }
                mask[i][offset + t] = 1.0;
            }
        }
        return new SequenceBatch(Nd4j.create(values), Nd4j.create(mask));
    }

    private static double[][] standardize(double[][] raw, double[] mean, double[] scale) {
        double[][] x = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            x[i] = new double[raw[i].length];
            for (int j = 0; j < raw[i].length; j++) {
                x[i][j] = (raw[i][j] - mean[j]) / scale[j];
            }
        }
        return x;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /** Population standard deviation, or 1 for a constant column. */
    private static double scale(double[] values, double mean) {
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(sum / values.length);
        return std > 1e-12 ? std : 1.0;
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
            meta.put("parameters", state.parameters().length);
        }
        return meta;
    }
}
