package tw.gc.auto.equity.research.testutil;

import tw.gc.auto.equity.research.dataset.DatasetRow;
import tw.gc.auto.equity.research.dataset.FeatureDataset;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Test factory for feature datasets with a known linear relationship between features and target.
 */
public class FeatureDatasetTestFactory {

    public static final String SCHEMA_VERSION = "v1";
    public static final String TARGET = "target_ret_5d";
    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    /**
     * Dataset with {@code days} consecutive dates, one row per entity per date, two features
     * and a noisy linear target {@code 0.6 * feat_momentum - 0.3 * feat_value}.
     */
    public static FeatureDataset linearDataset(int days, List<String> entities, long seed) {
        return new FeatureDataset(SCHEMA_VERSION, linearRows(days, entities, seed));
    }

    public static FeatureDataset linearDataset(int days) {
        return linearDataset(days, List.of("2330.TW", "2454.TW", "2317.TW"), 7L);
    }

    public static List<DatasetRow> linearRows(int days, List<String> entities, long seed) {
        Random random = new Random(seed);
        List<DatasetRow> rows = new ArrayList<>();
        for (int d = 0; d < days; d++) {
            LocalDate date = START.plusDays(d);
            for (String entity : entities) {
                double momentum = random.nextGaussian();
                double value = random.nextGaussian();
                double target = 0.6 * momentum - 0.3 * value + 0.05 * random.nextGaussian();
                rows.add(row(date, entity, Map.of(
                    "feat_momentum", momentum,
                    "feat_value", value,
                    TARGET, target)));
            }
        }
        return rows;
    }

    /**
     * Single-entity dataset whose feature and target both equal the day number.
     */
    public static FeatureDataset countingDataset(int days) {
        List<DatasetRow> rows = new ArrayList<>();
        for (int d = 0; d < days; d++) {
            rows.add(row(START.plusDays(d), "2330.TW", Map.of("feat_day", (double) d, TARGET, (double) d)));
        }
        return new FeatureDataset(SCHEMA_VERSION, rows);
    }

    public static DatasetRow row(LocalDate date, String entity, Map<String, Double> values) {
        return new DatasetRow(date, entity, new LinkedHashMap<>(values));
    }
}
