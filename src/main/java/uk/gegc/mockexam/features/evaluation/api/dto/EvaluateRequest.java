package uk.gegc.mockexam.features.evaluation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;

import java.util.List;
import java.util.Map;

@Schema(name = "EvaluateRequest", description = "A completed attempt to score")
public record EvaluateRequest(
        @Schema(description = "Questions of the attempt as returned by generation")
        List<@NotNull(message = "questions must not contain null entries") QuestionRecord> questions,

        @Schema(description = "Answer per question id: A-D, an integer for numerical questions, or null")
        @JsonProperty("user_answers")
        Map<Integer, String> userAnswers,

        @Schema(description = "Exam key selecting the marking scheme", example = "JEE")
        String exam,

        @Schema(description = "Time spent on the attempt in seconds", example = "5400")
        @JsonProperty("time_taken")
        @PositiveOrZero(message = "time_taken cannot be negative")
        Double timeTaken,

        @Schema(description = "Scores of other attempts, used to compute a percentile")
        @JsonProperty("all_scores")
        List<Double> allScores
) {
}
