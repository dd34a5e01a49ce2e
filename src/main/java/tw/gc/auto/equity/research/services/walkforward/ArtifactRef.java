package tw.gc.auto.equity.research.services.walkforward;

/**
 * Pointer to the registry entry produced by a successful window.
 */
public record ArtifactRef(String family, int version, String contentHash) {

    @Override
    public String toString() {
        return family + " v" + version;
    }
}
