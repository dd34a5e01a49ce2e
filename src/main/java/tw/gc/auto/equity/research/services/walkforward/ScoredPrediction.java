package tw.gc.auto.equity.research.services.walkforward;

import java.time.LocalDate;

/**
 * Out-of-sample score for one entity on one date, as consumed by universe selection.
 *
 * @param date        validation date
 * @param entity      ticker
 * @param score       model prediction
 * @param windowIndex window that produced the score
 */
public record ScoredPrediction(LocalDate date, String entity, double score, int windowIndex) {
}
