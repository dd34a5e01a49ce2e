package tw.gc.auto.equity.research.models;

/**
 * Closed set of model variants. Adapters are created and restored by dispatching on this tag.
 */
public enum ModelFamily {
    TREE_ENSEMBLE("tree-ensemble"),
    SEQUENCE_MODEL("sequence-model"),
    BASELINE("baseline");

    private final String registryName;

    ModelFamily(String registryName) {
        this.registryName = registryName;
    }

    /**
     * Default artifact family name used in the registry for models of this variant.
     */
    public String registryName() {
        return registryName;
    }
}
