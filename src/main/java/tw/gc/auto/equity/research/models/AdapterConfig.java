package tw.gc.auto.equity.research.models;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import tw.gc.auto.equity.research.exceptions.ConfigurationException;

/**
 * Configuration handed to {@link ModelAdapter#fit}. The seed is the only source of randomness an
 * adapter may use.
 *
 * @param seed            seed for every pseudo-random choice made during training
 * @param featurePrefix   naming prefix identifying feature columns
 * @param hyperparameters variant-specific numeric settings, kept sorted
 */
public record AdapterConfig(long seed, String featurePrefix, Map<String, Double> hyperparameters) {

    public static final long DEFAULT_SEED = 42L;
    public static final String DEFAULT_FEATURE_PREFIX = "feat_";

    public AdapterConfig {
        if (featurePrefix == null || featurePrefix.isBlank()) {
            throw new ConfigurationException("featurePrefix must be non-blank");
        }
        hyperparameters = hyperparameters == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(hyperparameters));
    }

    public static AdapterConfig defaults() {
        return new AdapterConfig(DEFAULT_SEED, DEFAULT_FEATURE_PREFIX, Map.of());
    }

    public AdapterConfig withSeed(long newSeed) {
        return new AdapterConfig(newSeed, featurePrefix, hyperparameters);
    }

    public AdapterConfig withHyperparameter(String name, double value) {
        Map<String, Double> copy = new TreeMap<>(hyperparameters);
        copy.put(name, value);
        return new AdapterConfig(seed, featurePrefix, copy);
    }

    public double hyperparameter(String name, double defaultValue) {
        return hyperparameters.getOrDefault(name, defaultValue);
    }

    public int intHyperparameter(String name, int defaultValue) {
        Double value = hyperparameters.get(name);
        return value == null ? defaultValue : (int) Math.round(value);
    }

    public boolean flag(String name) {
        return hyperparameter(name, 0.0) != 0.0;
    }
}
