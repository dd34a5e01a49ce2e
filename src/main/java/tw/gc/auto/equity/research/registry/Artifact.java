package tw.gc.auto.equity.research.registry;

import java.util.Arrays;

/**
 * A stored model: serialized adapter state plus its metadata. The payload array is copied on the
 * way in and on the way out so a caller can never alter stored bytes.
 */
public final class Artifact {

    private final ArtifactMetadata metadata;
    private final byte[] payload;

    public Artifact(ArtifactMetadata metadata, byte[] payload) {
        if (metadata == null || payload == null) {
            throw new IllegalArgumentException("metadata and payload must be non-null");
        }
        this.metadata = metadata;
        this.payload = payload.clone();
    }

    public String family() {
        return metadata.family();
    }

    public int version() {
        return metadata.version();
    }

    public ArtifactMetadata metadata() {
        return metadata;
    }

    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Artifact other)) return false;
        return metadata.equals(other.metadata) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * metadata.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Artifact[%s v%d, %d bytes, %s]".formatted(
            metadata.family(), metadata.version(), payload.length, metadata.contentHash());
    }
}
