package uk.gegc.mockexam.features.evaluation.application;

import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.evaluation.domain.model.PerformanceInsights;

import java.util.List;

/**
 * Presentation logic over an already scored attempt.
 */
public interface PerformanceInsightsService {

    PerformanceInsights insights(EvaluationResult result);

    /**
     * Share of {@code allScores} strictly below {@code score}, as a percentage rounded to two decimals.
     * Returns 0 for an empty list.
     */
    double calculatePercentile(double score, List<Double> allScores);
}
