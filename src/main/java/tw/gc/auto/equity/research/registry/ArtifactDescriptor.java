package tw.gc.auto.equity.research.registry;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Builder;

/**
 * Caller-supplied description of an artifact being stored. The registry completes it with the
 * version, content hash and creation time to form {@link ArtifactMetadata}.
 *
 * @param schemaVersion    contract version of the feature dataset the model was trained on
 * @param trainingWindow   exact window bounds
 * @param metricsSnapshot  validation metrics; undefined (non-finite) values are dropped
 * @param modelFamily      variant tag of the serialized adapter
 * @param featureColumns   feature columns used at fit time
 * @param targetColumn     target column used at fit time
 * @param hyperparameters  adapter hyperparameters
 * @param seed             seed the adapter was trained with
 */
@Builder
public record ArtifactDescriptor(
    String schemaVersion,
    TrainingWindowBounds trainingWindow,
    Map<String, Double> metricsSnapshot,
    String modelFamily,
    List<String> featureColumns,
    String targetColumn,
    Map<String, Double> hyperparameters,
    long seed
) {
    public ArtifactDescriptor {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            throw new IllegalArgumentException("schemaVersion is required");
        }
        if (trainingWindow == null) {
            throw new IllegalArgumentException("trainingWindow is required");
        }
        TreeMap<String, Double> metrics = new TreeMap<>();
        if (metricsSnapshot != null) {
            metricsSnapshot.forEach((name, value) -> {
                if (value != null && Double.isFinite(value)) {
                    metrics.put(name, value);
                }
            });
        }
        metricsSnapshot = Collections.unmodifiableSortedMap(metrics);
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
        hyperparameters = hyperparameters == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(hyperparameters));
    }
}
