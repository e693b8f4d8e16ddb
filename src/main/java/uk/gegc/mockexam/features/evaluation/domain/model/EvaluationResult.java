package uk.gegc.mockexam.features.evaluation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Optional;

/**
 * Scored attempt.
 *
 * <p>{@code totalMarks == positiveMarks - negativeMarks} and
 * {@code attempted + unattempted == totalQuestions}. {@code timeTaken} (seconds) and
 * {@code percentile} are only present when supplied by the caller.
 */
@JsonPropertyOrder({"total_marks", "positive_marks", "negative_marks", "total_questions", "attempted",
        "correct", "wrong", "unattempted", "accuracy", "subject_results", "question_details",
        "time_taken", "percentile"})
public record EvaluationResult(
        @JsonProperty("total_marks") double totalMarks,
        @JsonProperty("positive_marks") double positiveMarks,
        @JsonProperty("negative_marks") double negativeMarks,
        @JsonProperty("total_questions") int totalQuestions,
        int attempted,
        int correct,
        int wrong,
        int unattempted,
        double accuracy,
        @JsonProperty("subject_results") List<SubjectResult> subjectResults,
        @JsonProperty("question_details") List<QuestionDetail> questionDetails,
        @JsonProperty("time_taken") Double timeTaken,
        Double percentile
) {

    public EvaluationResult {
        subjectResults = List.copyOf(subjectResults);
        questionDetails = List.copyOf(questionDetails);
    }

    public Optional<SubjectResult> subjectResult(String subject) {
        return subjectResults.stream().filter(result -> result.subject().equals(subject)).findFirst();
    }

    public EvaluationResult withTimeTaken(Double seconds) {
        return new EvaluationResult(totalMarks, positiveMarks, negativeMarks, totalQuestions, attempted, correct,
                wrong, unattempted, accuracy, subjectResults, questionDetails, seconds, percentile);
    }

    public EvaluationResult withPercentile(Double newPercentile) {
        return new EvaluationResult(totalMarks, positiveMarks, negativeMarks, totalQuestions, attempted, correct,
                wrong, unattempted, accuracy, subjectResults, questionDetails, timeTaken, newPercentile);
    }
}
