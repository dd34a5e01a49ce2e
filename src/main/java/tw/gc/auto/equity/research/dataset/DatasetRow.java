package tw.gc.auto.equity.research.dataset;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One observation of the feature dataset: a single entity (ticker) on a single date.
 *
 * <p>Column values are kept in a sorted map so that iteration order, and therefore every
 * computation derived from it, is stable across runs.
 *
 * @param date   value of the dataset's time column
 * @param entity value of the dataset's entity column
 * @param values numeric columns (features, targets, anything else the producer wrote)
 */
public record DatasetRow(LocalDate date, String entity, Map<String, Double> values) {

    public DatasetRow {
        if (date == null) {
            throw new IllegalArgumentException("date must be non-null");
        }
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("entity must be non-null and non-blank");
        }
        if (values == null) {
            throw new IllegalArgumentException("values must be non-null");
        }
        values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    /**
     * Returns the value of a column, or {@code NaN} when the row does not carry it.
     */
    public double value(String column) {
        Double v = values.get(column);
        return v == null ? Double.NaN : v;
    }

    public boolean hasFinite(String column) {
        Double v = values.get(column);
        return v != null && Double.isFinite(v);
    }

    /**
     * Column names following the feature naming convention.
     */
    public Set<String> featureColumns(String prefix) {
        Set<String> columns = new TreeSet<>();
        for (String column : values.keySet()) {
            if (column.startsWith(prefix)) {
                columns.add(column);
            }
        }
        return columns;
    }
}
