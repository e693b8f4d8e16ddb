package uk.gegc.mockexam.features.generation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

@Schema(name = "SubjectRequest", description = "Generation settings for one subject")
public record SubjectRequest(
        @Schema(description = "Chapters to cover; empty for the full syllabus", example = "[\"Kinematics\", \"Laws of Motion\"]")
        List<@NotBlank(message = "chapter names must not be blank") String> chapters,

        @Schema(description = "Number of questions (1-100)", example = "10")
        @JsonProperty("num_questions")
        @NotNull(message = "num_questions is required")
        Integer numQuestions,

        @Schema(description = "Difficulty: Easy, Medium or Hard", example = "Medium", defaultValue = "Medium")
        String difficulty
) {

    public static final String DEFAULT_DIFFICULTY = "Medium";

    public String difficultyOrDefault() {
        return difficulty == null ? DEFAULT_DIFFICULTY : difficulty;
    }
}
