package tw.gc.auto.equity.research.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.exceptions.TrainingException;
import tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory.TARGET;
import static tw.gc.auto.equity.research.testutil.FeatureDatasetTestFactory.row;

class RecurrentSequenceAdapterTest {

    private final List<String> entities = List.of("2330.TW", "2454.TW");
    private final List<DatasetRow> training = FeatureDatasetTestFactory.linearRows(40, entities, 21L);
    private final List<DatasetRow> validation = FeatureDatasetTestFactory.linearRows(8, entities, 22L);

    private final AdapterConfig config = AdapterConfig.defaults()
        .withHyperparameter(RecurrentSequenceAdapter.HIDDEN_SIZE, 4)
        .withHyperparameter(RecurrentSequenceAdapter.LOOKBACK, 3)
        .withHyperparameter(RecurrentSequenceAdapter.EPOCHS, 5);

    @Test
    @DisplayName("should produce one finite score per row")
    void shouldPredict() {
        var adapter = new RecurrentSequenceAdapter();
        adapter.fit(training, TARGET, config);

        double[] scores = adapter.predict(validation);

        assertThat(scores).hasSize(validation.size());
        for (double score : scores) {
            assertThat(Double.isFinite(score)).isTrue();
        }
    }

    @Test
    @DisplayName("should produce identical predictions for the same seed")
    void shouldBeDeterministic() {
        var first = new RecurrentSequenceAdapter();
        var second = new RecurrentSequenceAdapter();
        first.fit(training, TARGET, config);
        second.fit(training, TARGET, config);

        double[] expected = first.predict(validation);
        double[] actual = second.predict(validation);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i]).isCloseTo(expected[i], within(first.predictionTolerance()));
        }
    }

    @Test
    @DisplayName("should produce different weights for a different seed")
    void shouldDependOnSeed() {
        var first = new RecurrentSequenceAdapter();
        var second = new RecurrentSequenceAdapter();
        first.fit(training, TARGET, config);
        second.fit(training, TARGET, config.withSeed(7L));

        assertThat(second.serialize()).isNotEqualTo(first.serialize());
    }

    @Test
    @DisplayName("should restore within tolerance from its serialized payload")
    void shouldRoundTrip() {
        var adapter = new RecurrentSequenceAdapter();
        adapter.fit(training, TARGET, config);

        ModelAdapter restored = ModelAdapters.deserialize(adapter.serialize());
        double[] original = adapter.predict(validation);
        double[] reloaded = restored.predict(validation);

        assertThat(restored.family()).isEqualTo(ModelFamily.SEQUENCE_MODEL);
        for (int i = 0; i < original.length; i++) {
            assertThat(reloaded[i]).isCloseTo(original[i], within(adapter.predictionTolerance()));
        }
    }

    @Test
    @DisplayName("should build per-entity history ordered by date")
    void shouldBuildSequences() {
        LocalDate d = LocalDate.of(2024, 5, 1);
        List<DatasetRow> rows = List.of(
            row(d, "A", Map.of("feat_x", 1.0)),
            row(d, "B", Map.of("feat_x", 1.0)),
            row(d.plusDays(1), "A", Map.of("feat_x", 1.0)),
            row(d.plusDays(2), "A", Map.of("feat_x", 1.0)),
            row(d.plusDays(1), "B", Map.of("feat_x", 1.0)));

        int[][] sequences = RecurrentSequenceAdapter.sequences(rows, 2);

        assertThat(sequences[0]).containsExactly(0);
        assertThat(sequences[2]).containsExactly(0, 2);
        assertThat(sequences[3]).containsExactly(2, 3);
        assertThat(sequences[4]).containsExactly(1, 4);
    }

    @Test
    @DisplayName("should clamp a non-positive lookback to one step when sizing the training set")
    void shouldClampLookback() {
        var adapter = new RecurrentSequenceAdapter();
        var zeroLookback = config.withHyperparameter(RecurrentSequenceAdapter.LOOKBACK, 0);

        assertThat(adapter.minimumTrainingRows(zeroLookback)).isEqualTo(2);
        assertThat(adapter.minimumTrainingRows(config.withHyperparameter(RecurrentSequenceAdapter.LOOKBACK, -4)))
            .isEqualTo(2);

        adapter.fit(training.subList(0, 2), TARGET, zeroLookback);
        assertThat(adapter.predict(validation)).hasSize(validation.size());
    }

    @Test
    @DisplayName("should score the first rows of an entity from a shorter history")
    void shouldScoreShortHistory() {
        var adapter = new RecurrentSequenceAdapter();
        adapter.fit(training, TARGET, config);

        double[] scores = adapter.predict(validation.subList(0, 1));

        assertThat(scores).hasSize(1);
        assertThat(Double.isFinite(scores[0])).isTrue();
    }

    @Test
    @DisplayName("should require more rows than the lookback")
    void shouldRejectShortHistory() {
        var rows = training.subList(0, 3);

        assertThatThrownBy(() -> new RecurrentSequenceAdapter().fit(rows, TARGET, config))
            .isInstanceOf(TrainingException.class);
    }
}
