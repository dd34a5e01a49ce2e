package tw.gc.auto.equity.research.models;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope written by {@link ModelAdapter#serialize()}. The family tag selects the variant on
 * restore; {@code state} is the variant's own trained state.
 */
public record SerializedModel(
    ModelFamily family,
    int formatVersion,
    List<String> featureColumns,
    String targetColumn,
    String featurePrefix,
    long seed,
    Map<String, Double> hyperparameters,
    JsonNode state
) {
    public static final int FORMAT_VERSION = 1;
}
