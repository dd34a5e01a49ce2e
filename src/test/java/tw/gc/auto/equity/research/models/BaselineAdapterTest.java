package tw.gc.auto.equity.research.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.exceptions.InferenceException;
import tw.gc.auto.equity.research.exceptions.TrainingException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory.row;

class BaselineAdapterTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 3);

    private final List<DatasetRow> training = List.of(
        row(D1, "A", Map.of("feat_x", 1.0, "y", 1.0)),
        row(D1, "B", Map.of("feat_x", 2.0, "y", 3.0)),
        row(D2, "A", Map.of("feat_x", 3.0, "y", 2.0)),
        row(D2, "B", Map.of("feat_x", 4.0, "y", 6.0)));

    @Nested
    @DisplayName("Fit and predict")
    class FitPredictTests {

        @Test
        @DisplayName("should predict the global target mean")
        void shouldPredictGlobalMean() {
            var adapter = new BaselineAdapter();
            adapter.fit(training, "y", AdapterConfig.defaults());

            double[] scores = adapter.predict(List.of(row(D2, "C", Map.of("feat_x", 0.0))));

            assertThat(adapter.isFitted()).isTrue();
            assertThat(scores).containsExactly(3.0);
        }

        @Test
        @DisplayName("should predict per-entity means with global fallback")
        void shouldPredictEntityMeans() {
            var adapter = new BaselineAdapter();
            adapter.fit(training, "y", AdapterConfig.defaults().withHyperparameter(BaselineAdapter.PER_ENTITY, 1));

            double[] scores = adapter.predict(List.of(
                row(D2, "A", Map.of("feat_x", 0.0)),
                row(D2, "B", Map.of("feat_x", 0.0)),
                row(D2, "Z", Map.of("feat_x", 0.0))));

            assertThat(scores).containsExactly(1.5, 4.5, 3.0);
        }

        @Test
        @DisplayName("should return no scores for no rows")
        void shouldHandleEmptyPrediction() {
            var adapter = new BaselineAdapter();
            adapter.fit(training, "y", AdapterConfig.defaults());

            assertThat(adapter.predict(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("should reject empty training rows")
        void shouldRejectEmptyRows() {
            assertThatThrownBy(() -> new BaselineAdapter().fit(List.of(), "y", AdapterConfig.defaults()))
                .isInstanceOf(TrainingException.class);
        }

        @Test
        @DisplayName("should reject rows without feature columns")
        void shouldRejectNoFeatures() {
            var rows = List.of(row(D1, "A", Map.of("y", 1.0)));

            assertThatThrownBy(() -> new BaselineAdapter().fit(rows, "y", AdapterConfig.defaults()))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("feat_");
        }

        @Test
        @DisplayName("should reject rows missing the target")
        void shouldRejectMissingTarget() {
            assertThatThrownBy(() -> new BaselineAdapter().fit(training, "missing", AdapterConfig.defaults()))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("should reject a second fit")
        void shouldRejectRefit() {
            var adapter = new BaselineAdapter();
            adapter.fit(training, "y", AdapterConfig.defaults());

            assertThatThrownBy(() -> adapter.fit(training, "y", AdapterConfig.defaults()))
                .isInstanceOf(TrainingException.class);
        }

        @Test
        @DisplayName("should reject predict before fit")
        void shouldRejectPredictBeforeFit() {
            assertThatThrownBy(() -> new BaselineAdapter().predict(training))
                .isInstanceOf(InferenceException.class);
        }

        @Test
        @DisplayName("should reject rows with different feature columns")
        void shouldRejectSchemaMismatch() {
            var adapter = new BaselineAdapter();
            adapter.fit(training, "y", AdapterConfig.defaults());

            assertThatThrownBy(() -> adapter.predict(List.of(row(D2, "A", Map.of("feat_other", 1.0)))))
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("feat_other");
        }

        @Test
        @DisplayName("should refuse to serialize before fit")
        void shouldRejectSerializeBeforeFit() {
            assertThatThrownBy(() -> new BaselineAdapter().serialize())
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("should describe family, features and target")
    void shouldDescribe() {
        var adapter = new BaselineAdapter();
        adapter.fit(training, "y", AdapterConfig.defaults());

        assertThat(adapter.describe())
            .containsEntry("family", "baseline")
            .containsEntry("targetColumn", "y")
            .containsEntry("featureColumns", List.of("feat_x"));
        assertThat(adapter.featureSchema().columns()).containsExactly("feat_x");
    }
}
