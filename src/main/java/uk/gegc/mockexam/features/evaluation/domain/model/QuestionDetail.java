package uk.gegc.mockexam.features.evaluation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"id", "subject", "question", "your_answer", "correct_answer", "is_correct", "marks_obtained", "solution"})
public record QuestionDetail(
        Integer id,
        String subject,
        String question,
        @JsonProperty("your_answer") String yourAnswer,
        @JsonProperty("correct_answer") String correctAnswer,
        @JsonProperty("is_correct") boolean answeredCorrectly,
        @JsonProperty("marks_obtained") double marksObtained,
        String solution
) {
}
