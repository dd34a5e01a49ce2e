package tw.gc.auto.equity.research.dataset;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import lombok.Getter;
import tw.gc.auto.equity.research.exceptions.DataException;

/**
 * Time-ordered tabular dataset handed over by the feature-engineering pipeline.
 *
 * <p>The time index is the sorted, duplicate-free list of dates present in the rows. Windows
 * address the dataset by position in that index, so a slice {@code [start, end)} contains every
 * row (all entities) whose date lies at positions {@code start..end-1}.
 */
@Getter
public class FeatureDataset {

    public static final String DEFAULT_TIME_COLUMN = "date";
    public static final String DEFAULT_ENTITY_COLUMN = "ticker";

    private final String schemaVersion;
    private final String timeColumn;
    private final String entityColumn;
    private final List<DatasetRow> rows;
    private final List<LocalDate> timeIndex;

    /** Offsets into {@link #rows}: rows of date i live in [rowOffsets[i], rowOffsets[i+1]). */
    private final int[] rowOffsets;

    public FeatureDataset(String schemaVersion, String timeColumn, String entityColumn, List<DatasetRow> rows) {
        if (schemaVersion == null || schemaVersion.isBlank()) {
            throw new DataException("Dataset schema_version is required");
        }
        if (rows == null) {
            throw new DataException("Dataset rows must be non-null");
        }
        this.schemaVersion = schemaVersion;
        this.timeColumn = timeColumn == null ? DEFAULT_TIME_COLUMN : timeColumn;
        this.entityColumn = entityColumn == null ? DEFAULT_ENTITY_COLUMN : entityColumn;

        List<DatasetRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(DatasetRow::date).thenComparing(DatasetRow::entity));
        for (int i = 1; i < sorted.size(); i++) {
            DatasetRow prev = sorted.get(i - 1);
            DatasetRow cur = sorted.get(i);
            if (prev.date().equals(cur.date()) && prev.entity().equals(cur.entity())) {
                throw new DataException("Duplicate row for %s on %s".formatted(cur.entity(), cur.date()));
            }
        }
        this.rows = List.copyOf(sorted);
        this.timeIndex = List.copyOf(new TreeSet<>(sorted.stream().map(DatasetRow::date).toList()));

        this.rowOffsets = new int[timeIndex.size() + 1];
        int position = 0;
        for (int i = 0; i < timeIndex.size(); i++) {
            rowOffsets[i] = position;
            LocalDate date = timeIndex.get(i);
            while (position < this.rows.size() && this.rows.get(position).date().equals(date)) {
                position++;
            }
        }
        rowOffsets[timeIndex.size()] = position;
    }

    public FeatureDataset(String schemaVersion, List<DatasetRow> rows) {
        this(schemaVersion, DEFAULT_TIME_COLUMN, DEFAULT_ENTITY_COLUMN, rows);
    }

    public int timeIndexLength() {
        return timeIndex.size();
    }

    /**
     * Rows whose date lies in the half-open position range {@code [start, end)} of the time index.
     */
    public List<DatasetRow> slice(int start, int end) {
        if (start < 0 || end > timeIndex.size() || start > end) {
            throw new DataException("Slice [%d, %d) outside time index of length %d"
                .formatted(start, end, timeIndex.size()));
        }
        return rows.subList(rowOffsets[start], rowOffsets[end]);
    }

    public LocalDate dateAt(int position) {
        return timeIndex.get(position);
    }

    /**
     * Feature columns present on every row, discovered by naming prefix.
     */
    public List<String> featureColumns(String prefix) {
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> counts = new HashMap<>();
        for (DatasetRow row : rows) {
            for (String column : row.featureColumns(prefix)) {
                counts.merge(column, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .filter(e -> e.getValue() == rows.size())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }
}
