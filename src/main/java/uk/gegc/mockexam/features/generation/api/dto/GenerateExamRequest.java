package uk.gegc.mockexam.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;

import java.util.List;
import java.util.Map;

@Schema(name = "GenerateExamRequest", description = "Request to generate a mock exam")
public record GenerateExamRequest(
        @Schema(description = "Exam key", example = "JEE")
        @NotBlank(message = "exam is required")
        String exam,

        @Schema(description = "Settings per subject, in output order")
        @JsonProperty("subject_data")
        @NotEmpty(message = "subject_data must contain at least one subject")
        Map<String, @NotNull(message = "subject settings are required") @Valid SubjectRequest> subjectData
) {

    /**
     * Subject configurations in request order.
     */
    public List<SubjectConfig> toSubjectConfigs() {
        return subjectData.entrySet().stream()
                .map(entry -> new SubjectConfig(
                        entry.getKey(),
                        entry.getValue().chapters(),
                        entry.getValue().numQuestions(),
                        entry.getValue().difficultyOrDefault()))
                .toList();
    }
}
