package uk.gegc.mockexam.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "SubjectListResponse", description = "Subjects of an exam")
public record SubjectListResponse(
        @Schema(description = "Exam key", example = "JEE")
        String exam,

        @Schema(description = "Subjects in syllabus order")
        List<String> subjects
) {
}
