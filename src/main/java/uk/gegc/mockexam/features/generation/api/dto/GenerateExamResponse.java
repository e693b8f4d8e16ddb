package uk.gegc.mockexam.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mockexam.features.generation.domain.model.GeneratedExam;
import uk.gegc.mockexam.features.generation.domain.model.GenerationMetadata;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;

import java.util.List;
import java.util.Map;

@Schema(name = "GenerateExamResponse", description = "Generated exam questions")
public record GenerateExamResponse(
        @Schema(description = "Always true for a successful call", example = "true")
        boolean success,

        @Schema(description = "All questions in subject order")
        List<QuestionRecord> questions,

        @Schema(description = "Questions grouped by subject; failed subjects are empty")
        @JsonProperty("by_subject")
        Map<String, List<QuestionRecord>> bySubject,

        @Schema(description = "Failure message per failed subject")
        Map<String, String> failures,

        @Schema(description = "Counts and timing of the run")
        GenerationMetadata metadata
) {

    public static GenerateExamResponse from(GeneratedExam exam) {
        return new GenerateExamResponse(true, exam.questions(), exam.bySubject(), exam.failures(), exam.metadata());
    }
}
