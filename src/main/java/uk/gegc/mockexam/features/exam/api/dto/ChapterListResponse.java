package uk.gegc.mockexam.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ChapterListResponse", description = "Chapters of a subject")
public record ChapterListResponse(
        @Schema(description = "Exam key", example = "JEE")
        String exam,

        @Schema(description = "Subject", example = "Physics")
        String subject,

        @Schema(description = "Chapters in syllabus order")
        List<String> chapters
) {
}
