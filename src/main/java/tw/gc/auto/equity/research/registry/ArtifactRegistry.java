package tw.gc.auto.equity.research.registry;

import java.util.List;

/**
 * Versioned, immutable store of model artifacts keyed by {@code (family, version)}.
 *
 * <p>Versions are positive integers assigned per family. Stored artifacts are never modified;
 * a correction is a new version.
 */
public interface ArtifactRegistry {

    /**
     * Stores a payload under the next version of the family ({@code max + 1}, or 1 for a new
     * family). If the family already holds a payload with the same content hash, nothing is
     * written and that version is returned.
     *
     * @return the version holding the payload
     */
    int put(String family, byte[] payload, ArtifactDescriptor descriptor);

    /**
     * Stores a payload under an explicit version.
     *
     * @return the version holding the payload
     * @throws tw.gc.auto.equity.research.exceptions.RegistryConflictException if the version
     *         already exists with different content
     */
    int put(String family, byte[] payload, ArtifactDescriptor descriptor, int explicitVersion);

    /**
     * @throws tw.gc.auto.equity.research.exceptions.RegistryNotFoundException if the family or the
     *         version is unknown
     */
    Artifact get(String family, VersionSelector selector);

    /**
     * Metadata of every version of the family in ascending version order; empty for an unknown
     * family. Payloads are not loaded.
     */
    List<ArtifactMetadata> list(String family);

    /**
     * Families that hold at least one version, sorted by name.
     */
    List<String> families();
}
