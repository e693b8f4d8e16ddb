package uk.gegc.mockexam.features.evaluation.application.impl;

import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.evaluation.application.PerformanceInsightsService;
import uk.gegc.mockexam.features.evaluation.domain.model.Accuracy;
import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.evaluation.domain.model.PerformanceInsights;
import uk.gegc.mockexam.features.evaluation.domain.model.SubjectResult;

import java.util.ArrayList;
import java.util.List;

@Service
public class PerformanceInsightsServiceImpl implements PerformanceInsightsService {

    private static final double EXCELLENT_ACCURACY = 80.0;
    private static final double GOOD_ACCURACY = 60.0;
    private static final double WEAK_SUBJECT_ACCURACY = 50.0;
    private static final double MIN_ATTEMPT_RATE = 80.0;
    private static final double NEGATIVE_MARKS_RATIO = 0.3;

    @Override
    public PerformanceInsights insights(EvaluationResult result) {
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (result.accuracy() >= EXCELLENT_ACCURACY) {
            strengths.add("Excellent overall accuracy");
        } else if (result.accuracy() >= GOOD_ACCURACY) {
            strengths.add("Good overall performance");
        } else {
            weaknesses.add("Overall accuracy needs improvement");
        }

        for (SubjectResult subjectResult : result.subjectResults()) {
            String subject = subjectResult.subject();
            if (subjectResult.accuracy() >= EXCELLENT_ACCURACY) {
                strengths.add("Strong performance in " + subject);
            } else if (subjectResult.accuracy() < WEAK_SUBJECT_ACCURACY) {
                weaknesses.add("Weak performance in " + subject);
                recommendations.add("Focus more on " + subject + " - review concepts and practice more questions");
            }
        }

        if (result.totalQuestions() > 0) {
            double attemptRate = result.attempted() * 100.0 / result.totalQuestions();
            if (attemptRate < MIN_ATTEMPT_RATE) {
                recommendations.add("Try to attempt more questions - unattempted questions give 0 marks");
            }
        }

        if (result.negativeMarks() > result.positiveMarks() * NEGATIVE_MARKS_RATIO) {
            recommendations.add("Be more careful with answers - high negative marking detected");
        }

        return new PerformanceInsights(strengths, weaknesses, recommendations);
    }

    @Override
    public double calculatePercentile(double score, List<Double> allScores) {
        if (allScores == null || allScores.isEmpty()) {
            return 0.0;
        }
        long below = allScores.stream().filter(other -> other != null && other < score).count();
        return Accuracy.round2(below * 100.0 / allScores.size());
    }
}
