package uk.gegc.mockexam.features.evaluation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-subject rollup. Accuracy is derived from the counts on every read.
 */
@JsonPropertyOrder({"subject", "total_questions", "attempted", "correct", "wrong", "unattempted",
        "marks_obtained", "max_marks", "accuracy"})
public record SubjectResult(
        String subject,
        @JsonProperty("total_questions") int totalQuestions,
        int attempted,
        int correct,
        int wrong,
        int unattempted,
        @JsonProperty("marks_obtained") double marksObtained,
        @JsonProperty("max_marks") double maxMarks
) {

    /**
     * {@code correct / attempted * 100} rounded to two decimals, 0 when nothing was attempted.
     */
    @JsonProperty("accuracy")
    public double accuracy() {
        return Accuracy.percent(correct, attempted);
    }
}
