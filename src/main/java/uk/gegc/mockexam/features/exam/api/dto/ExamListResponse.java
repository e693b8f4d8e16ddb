package uk.gegc.mockexam.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ExamListResponse", description = "Exams with a syllabus")
public record ExamListResponse(
        @Schema(description = "Exam keys", example = "[\"JEE\", \"NEET\", \"UPSC\"]")
        List<String> exams
) {
}
