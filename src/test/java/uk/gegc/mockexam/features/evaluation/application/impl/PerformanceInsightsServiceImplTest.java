package uk.gegc.mockexam.features.evaluation.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.evaluation.domain.model.PerformanceInsights;
import uk.gegc.mockexam.features.evaluation.domain.model.SubjectResult;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PerformanceInsightsServiceImpl")
class PerformanceInsightsServiceImplTest {

    private final PerformanceInsightsServiceImpl service = new PerformanceInsightsServiceImpl();

    private static EvaluationResult result(int total, int correct, int wrong, List<SubjectResult> subjects) {
        int attempted = correct + wrong;
        double accuracy = attempted == 0 ? 0.0 : Math.round(correct * 10000.0 / attempted) / 100.0;
        return new EvaluationResult(correct * 4.0 - wrong, correct * 4.0, wrong, total, attempted,
                correct, wrong, total - attempted, accuracy, subjects, List.of(), null, null);
    }

    private static SubjectResult subject(String name, int total, int correct, int wrong) {
        return new SubjectResult(name, total, correct + wrong, correct, wrong, total - correct - wrong,
                correct * 4.0 - wrong, total * 4.0);
    }

    @Test
    @DisplayName("high accuracy is a strength and strong subjects are named")
    void excellentPerformance() {
        PerformanceInsights insights = service.insights(result(10, 9, 1,
                List.of(subject("Physics", 5, 5, 0), subject("Chemistry", 5, 4, 1))));

        assertThat(insights.strengths()).containsExactly(
                "Excellent overall accuracy", "Strong performance in Physics", "Strong performance in Chemistry");
        assertThat(insights.weaknesses()).isEmpty();
        assertThat(insights.recommendations()).isEmpty();
    }

    @Test
    @DisplayName("accuracy between 60 and 80 is good overall performance")
    void goodPerformance() {
        PerformanceInsights insights = service.insights(result(10, 7, 3, List.of(subject("Physics", 10, 7, 3))));

        assertThat(insights.strengths()).containsExactly("Good overall performance");
    }

    @Test
    @DisplayName("weak subjects get a weakness and a focus recommendation")
    void weakSubject() {
        PerformanceInsights insights = service.insights(result(10, 3, 5,
                List.of(subject("Mathematics", 10, 3, 5))));

        assertThat(insights.weaknesses()).containsExactly(
                "Overall accuracy needs improvement", "Weak performance in Mathematics");
        assertThat(insights.recommendations()).contains(
                "Focus more on Mathematics - review concepts and practice more questions");
    }

    @Test
    @DisplayName("a low attempt rate is called out")
    void lowAttemptRate() {
        PerformanceInsights insights = service.insights(result(10, 5, 0, List.of()));

        assertThat(insights.recommendations())
                .containsExactly("Try to attempt more questions - unattempted questions give 0 marks");
    }

    @Test
    @DisplayName("heavy negative marking is called out")
    void heavyNegativeMarking() {
        PerformanceInsights insights = service.insights(result(10, 2, 8, List.of()));

        assertThat(insights.recommendations())
                .contains("Be more careful with answers - high negative marking detected");
    }

    @Test
    @DisplayName("percentile is the share of strictly lower scores")
    void percentile() {
        assertThat(service.calculatePercentile(50, List.of(10.0, 20.0, 50.0, 60.0))).isEqualTo(50.0);
        assertThat(service.calculatePercentile(100, List.of(10.0, 20.0, 30.0))).isEqualTo(100.0);
        assertThat(service.calculatePercentile(15, List.of(10.0, 20.0, 30.0))).isEqualTo(33.33);
    }

    @Test
    @DisplayName("percentile without other scores is zero")
    void percentileWithoutScores() {
        assertThat(service.calculatePercentile(42, List.of())).isZero();
        assertThat(service.calculatePercentile(42, null)).isZero();
        assertThat(service.calculatePercentile(42, Arrays.asList(null, 10.0))).isEqualTo(50.0);
    }
}
