package tw.gc.auto.equity.research.models;

/**
 * Creates and restores adapters by dispatching on {@link ModelFamily}.
 */
public final class ModelAdapters {

    private ModelAdapters() {
        // Utility class
    }

    /**
     * Factory producing a fresh, unfitted adapter of the given family on every call.
     */
    public static ModelAdapterFactory factoryFor(ModelFamily family) {
        if (family == null) {
            throw new IllegalArgumentException("family must be non-null");
        }
        return switch (family) {
            case TREE_ENSEMBLE -> GradientBoostedTreesAdapter::new;
            case SEQUENCE_MODEL -> RecurrentSequenceAdapter::new;
            case BASELINE -> BaselineAdapter::new;
        };
    }

    /**
     * Restores a fitted adapter from the payload produced by {@link ModelAdapter#serialize()}.
     *
     * @throws IllegalArgumentException if the payload is not a serialized model
     */
    public static ModelAdapter deserialize(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("Payload is empty");
        }
        SerializedModel envelope = AdapterSupport.decode(payload);
        if (envelope.family() == null) {
            throw new IllegalArgumentException("Payload carries no model family");
        }
        if (envelope.formatVersion() != SerializedModel.FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported model format version " + envelope.formatVersion());
        }
        AdapterSupport.FitContext context = AdapterSupport.contextOf(envelope);
        return switch (envelope.family()) {
            case TREE_ENSEMBLE -> new GradientBoostedTreesAdapter(
                context, AdapterSupport.stateOf(envelope, GradientBoostedTreesAdapter.State.class));
            case SEQUENCE_MODEL -> new RecurrentSequenceAdapter(
                context, AdapterSupport.stateOf(envelope, RecurrentSequenceAdapter.State.class));
            case BASELINE -> new BaselineAdapter(
                context, AdapterSupport.stateOf(envelope, BaselineAdapter.State.class));
        };
    }
}
