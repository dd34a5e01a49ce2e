package tw.gc.auto.equity.research.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import tw.gc.auto.equity.research.services.walkforward.WalkForwardRequest;
import tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory.TARGET;

class ModelAdaptersTest {

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    @DisplayName("should create a fresh unfitted adapter for every family")
    void shouldCreateFreshAdapters(ModelFamily family) {
        ModelAdapterFactory factory = ModelAdapters.factoryFor(family);

        ModelAdapter first = factory.create();
        ModelAdapter second = factory.create();

        assertThat(first).isNotSameAs(second);
        assertThat(first.family()).isEqualTo(family);
        assertThat(first.isFitted()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    @DisplayName("should record the family in the payload")
    void shouldRecordFamily(ModelFamily family) {
        var rows = FeatureDatasetTestFactory.linearRows(30, List.of("A", "B"), 3L);
        ModelAdapter adapter = ModelAdapters.factoryFor(family).create();
        adapter.fit(rows, TARGET, AdapterConfig.defaults()
            .withHyperparameter(GradientBoostedTreesAdapter.N_ESTIMATORS, 5)
            .withHyperparameter(RecurrentSequenceAdapter.EPOCHS, 1));

        byte[] payload = adapter.serialize();

        ModelAdapter restored = ModelAdapters.deserialize(payload);
        assertThat(restored.family()).isEqualTo(family);
        assertThat(restored.featureSchema()).isEqualTo(adapter.featureSchema());
    }

    @Test
    @DisplayName("should reject payloads that are not serialized models")
    void shouldRejectGarbage() {
        assertThatThrownBy(() -> ModelAdapters.deserialize("not json".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelAdapters.deserialize(new byte[0]))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelAdapters.deserialize("{\"formatVersion\":1}".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should reject an unsupported format version")
    void shouldRejectFormatVersion() {
        byte[] payload = "{\"family\":\"BASELINE\",\"formatVersion\":99}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ModelAdapters.deserialize(payload))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("99");
    }

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    @DisplayName("should use the registry name as the default artifact family of a request")
    void shouldUseRegistryNameAsArtifactFamily(ModelFamily family) {
        assertThat(WalkForwardRequest.forFamily(family).build().artifactFamily()).isEqualTo(family.registryName());
    }
}
