package tw.gc.auto.equity.research.registry;

import java.time.LocalDate;

/**
 * Exact window an artifact was trained and validated on: half-open time-index positions plus
 * the first and last dates actually covered by each range.
 */
public record TrainingWindowBounds(
    int windowIndex,
    int trainStart,
    int trainEnd,
    int valStart,
    int valEnd,
    LocalDate trainFirstDate,
    LocalDate trainLastDate,
    LocalDate valFirstDate,
    LocalDate valLastDate
) {
}
