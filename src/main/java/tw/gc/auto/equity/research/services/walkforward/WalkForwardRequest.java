package tw.gc.auto.equity.research.services.walkforward;

import java.util.List;

import lombok.Builder;
import tw.gc.auto.equity.research.dataset.FeatureDataset;
import tw.gc.auto.equity.research.dataset.TargetColumnResolver;
import tw.gc.auto.equity.research.metrics.MetricFunction;
import tw.gc.auto.equity.research.models.AdapterConfig;
import tw.gc.auto.equity.research.models.ModelAdapterFactory;
import tw.gc.auto.equity.research.models.ModelAdapters;
import tw.gc.auto.equity.research.models.ModelFamily;

/**
 * Everything a walk-forward run needs.
 *
 * @param dataset         time-ordered feature dataset
 * @param schedulerConfig window scheduling; {@code null} falls back to {@code walkforward.*} properties
 * @param adapterFactory  creates one fresh adapter per window
 * @param adapterConfig   seed, feature prefix and hyperparameters; {@code null} falls back to properties
 * @param targetResolver  picks the target column
 * @param metrics         one or more validation metrics
 * @param artifactFamily  registry family the window artifacts are stored under
 */
@Builder
public record WalkForwardRequest(
    FeatureDataset dataset,
    WindowSchedulerConfig schedulerConfig,
    ModelAdapterFactory adapterFactory,
    AdapterConfig adapterConfig,
    TargetColumnResolver targetResolver,
    List<MetricFunction> metrics,
    String artifactFamily
) {
    public WalkForwardRequest {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    /**
     * Builder pre-filled with the built-in adapter of {@code family} and its registry name.
     */
    public static WalkForwardRequestBuilder forFamily(ModelFamily family) {
        return builder()
            .adapterFactory(ModelAdapters.factoryFor(family))
            .artifactFamily(family.registryName());
    }
}
