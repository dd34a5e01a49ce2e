package tw.gc.auto.equity.research.registry;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Builder;

/**
 * Immutable metadata stored next to every artifact. These fields are the compatibility contract
 * read by downstream scoring and audit tooling.
 */
@Builder
public record ArtifactMetadata(
    String family,
    int version,
    String schemaVersion,
    TrainingWindowBounds trainingWindow,
    Map<String, Double> metricsSnapshot,
    String contentHash,
    Instant createdAt,
    long sizeBytes,
    String modelFamily,
    List<String> featureColumns,
    String targetColumn,
    Map<String, Double> hyperparameters,
    long seed
) {
    public ArtifactMetadata {
        metricsSnapshot = metricsSnapshot == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(metricsSnapshot));
        featureColumns = featureColumns == null ? List.of() : List.copyOf(featureColumns);
        hyperparameters = hyperparameters == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(hyperparameters));
    }

    static ArtifactMetadata of(String family, int version, ArtifactDescriptor descriptor,
            String contentHash, Instant createdAt, long sizeBytes) {
        return ArtifactMetadata.builder()
            .family(family)
            .version(version)
            .schemaVersion(descriptor.schemaVersion())
            .trainingWindow(descriptor.trainingWindow())
            .metricsSnapshot(descriptor.metricsSnapshot())
            .contentHash(contentHash)
            .createdAt(createdAt)
            .sizeBytes(sizeBytes)
            .modelFamily(descriptor.modelFamily())
            .featureColumns(descriptor.featureColumns())
            .targetColumn(descriptor.targetColumn())
            .hyperparameters(descriptor.hyperparameters())
            .seed(descriptor.seed())
            .build();
    }
}
