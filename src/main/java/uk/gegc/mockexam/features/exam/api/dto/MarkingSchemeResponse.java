package uk.gegc.mockexam.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mockexam.features.exam.domain.model.MarkingScheme;

@Schema(name = "MarkingSchemeResponse", description = "Marks per question outcome")
public record MarkingSchemeResponse(
        @Schema(description = "Exam key", example = "JEE")
        String exam,

        @Schema(description = "Marks for a correct answer", example = "4")
        double correct,

        @Schema(description = "Marks for a wrong answer", example = "-1")
        double wrong,

        @Schema(description = "Marks for an unattempted question", example = "0")
        double unattempted
) {

    public static MarkingSchemeResponse of(String exam, MarkingScheme scheme) {
        return new MarkingSchemeResponse(exam, scheme.correct(), scheme.wrong(), scheme.unattempted());
    }
}
