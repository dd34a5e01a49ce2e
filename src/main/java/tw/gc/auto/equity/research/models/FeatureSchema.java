package tw.gc.auto.equity.research.models;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

import tw.gc.auto.equity.research.dataset.DatasetRow;

/**
 * Ordered set of feature columns an adapter was fitted on, plus the conversions from rows to
 * dense matrices shared by every variant.
 *
 * @param columns sorted feature column names
 */
public record FeatureSchema(List<String> columns) {

    public FeatureSchema {
        columns = List.copyOf(new TreeSet<>(columns));
    }

    /**
     * Union of the prefix-matching columns carried by the rows.
     */
    public static FeatureSchema discover(List<DatasetRow> rows, String prefix) {
        Set<String> columns = new TreeSet<>();
        for (DatasetRow row : rows) {
            columns.addAll(row.featureColumns(prefix));
        }
        return new FeatureSchema(List.copyOf(columns));
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Dense row-major matrix of the schema's columns. A missing or non-finite value is reported
     * through {@code onMissing}.
     */
    public double[][] toMatrix(List<DatasetRow> rows, Function<String, ? extends RuntimeException> onMissing) {
        double[][] matrix = new double[rows.size()][columns.size()];
        for (int i = 0; i < rows.size(); i++) {
            DatasetRow row = rows.get(i);
            for (int j = 0; j < columns.size(); j++) {
                String column = columns.get(j);
                if (!row.hasFinite(column)) {
                    throw onMissing.apply("Row %s/%s lacks feature '%s'".formatted(row.entity(), row.date(), column));
                }
                matrix[i][j] = row.value(column);
            }
        }
        return matrix;
    }

    public static double[] targets(List<DatasetRow> rows, String targetColumn,
            Function<String, ? extends RuntimeException> onMissing) {
        double[] targets = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            DatasetRow row = rows.get(i);
            if (!row.hasFinite(targetColumn)) {
                throw onMissing.apply("Row %s/%s lacks target '%s'".formatted(row.entity(), row.date(), targetColumn));
            }
            targets[i] = row.value(targetColumn);
        }
        return targets;
    }
}
