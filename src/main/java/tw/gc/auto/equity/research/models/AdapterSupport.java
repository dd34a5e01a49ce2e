package tw.gc.auto.equity.research.models;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import tw.gc.auto.equity.research.config.CanonicalJson;
import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.exceptions.InferenceException;
import tw.gc.auto.equity.research.exceptions.TrainingException;

/**
 * Validation and encoding shared by the adapter variants.
 */
final class AdapterSupport {

    private AdapterSupport() {
        // Utility class
    }

    /** Matrix, targets and schema of a validated training set. */
    record TrainingData(FeatureSchema schema, double[][] features, double[] targets) {
    }

    /** What an adapter remembers about the fit call besides its trained parameters. */
    record FitContext(FeatureSchema schema, String targetColumn, AdapterConfig config) {
    }

    static TrainingData prepareFit(ModelAdapter adapter, List<DatasetRow> rows, String targetColumn,
            AdapterConfig config) {
        if (adapter.isFitted()) {
            throw new TrainingException(adapter.family() + " adapter has already been fitted");
        }
        if (config == null) {
            throw new TrainingException("AdapterConfig must be non-null");
        }
        if (targetColumn == null || targetColumn.isBlank()) {
            throw new TrainingException("Target column must be non-blank");
        }
        if (rows == null || rows.isEmpty()) {
            throw new TrainingException("Training rows are empty");
        }
        int minimum = adapter.minimumTrainingRows(config);
        if (rows.size() < minimum) {
            throw new TrainingException("%s requires at least %d training rows, got %d"
                .formatted(adapter.family(), minimum, rows.size()));
        }
        FeatureSchema schema = FeatureSchema.discover(rows, config.featurePrefix());
        if (schema.isEmpty()) {
            throw new TrainingException("No feature columns with prefix '%s' in training rows"
                .formatted(config.featurePrefix()));
        }
        double[][] features = schema.toMatrix(rows, TrainingException::new);
        double[] targets = FeatureSchema.targets(rows, targetColumn, TrainingException::new);
        return new TrainingData(schema, features, targets);
    }

    static double[][] preparePredict(ModelAdapter adapter, FitContext context, List<DatasetRow> rows) {
        if (!adapter.isFitted() || context == null) {
            throw new InferenceException(adapter.family() + " adapter has not been fitted");
        }
        if (rows == null) {
            throw new InferenceException("Rows to score must be non-null");
        }
        if (rows.isEmpty()) {
            return new double[0][];
        }
        FeatureSchema input = FeatureSchema.discover(rows, context.config().featurePrefix());
        if (!input.equals(context.schema())) {
            throw new InferenceException("Feature columns %s differ from fit-time columns %s"
                .formatted(input.columns(), context.schema().columns()));
        }
        return context.schema().toMatrix(rows, InferenceException::new);
    }

    static void checkInterrupted(ModelFamily family) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TrainingException(family + " training interrupted");
        }
    }

    static byte[] encode(ModelFamily family, FitContext context, Object state) {
        if (context == null) {
            throw new IllegalStateException(family + " adapter must be fitted before serialization");
        }
        ObjectMapper mapper = CanonicalJson.mapper();
        SerializedModel envelope = new SerializedModel(
            family,
            SerializedModel.FORMAT_VERSION,
            context.schema().columns(),
            context.targetColumn(),
            context.config().featurePrefix(),
            context.config().seed(),
            context.config().hyperparameters(),
            mapper.valueToTree(state));
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + family + " model", e);
        }
    }

    static SerializedModel decode(byte[] payload) {
        try {
            return CanonicalJson.mapper().readValue(payload, SerializedModel.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Payload is not a serialized model", e);
        }
    }

    static <T> T stateOf(SerializedModel envelope, Class<T> type) {
        JsonNode state = envelope.state();
        try {
            return CanonicalJson.mapper().treeToValue(state, type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Corrupt " + envelope.family() + " model state", e);
        }
    }

    static FitContext contextOf(SerializedModel envelope) {
        return new FitContext(
            new FeatureSchema(envelope.featureColumns()),
            envelope.targetColumn(),
            new AdapterConfig(envelope.seed(), envelope.featurePrefix(), envelope.hyperparameters()));
    }

    static Map<String, Object> describe(ModelFamily family, FitContext context) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("family", family.registryName());
        meta.put("fitted", context != null);
        if (context != null) {
            meta.put("featureColumns", context.schema().columns());
            meta.put("targetColumn", context.targetColumn());
            meta.put("seed", context.config().seed());
            meta.put("hyperparameters", context.config().hyperparameters());
        }
        return meta;
    }
}
