package uk.gegc.mockexam.features.exam.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.mockexam.features.exam.api.dto.ChapterListResponse;
import uk.gegc.mockexam.features.exam.api.dto.ExamListResponse;
import uk.gegc.mockexam.features.exam.api.dto.MarkingSchemeResponse;
import uk.gegc.mockexam.features.exam.api.dto.SubjectListResponse;
import uk.gegc.mockexam.features.exam.application.ExamCatalogService;

@RestController
@RequestMapping("/api/exams")
@RequiredArgsConstructor
@Tag(name = "Exam Catalog", description = "Syllabus and marking scheme lookup")
public class ExamCatalogController {

    private final ExamCatalogService catalogService;

    @Operation(summary = "List exams")
    @GetMapping
    public ResponseEntity<ExamListResponse> listExams() {
        return ResponseEntity.ok(new ExamListResponse(catalogService.listExams()));
    }

    @Operation(summary = "List subjects of an exam")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subjects returned"),
            @ApiResponse(responseCode = "400", description = "Unknown exam")
    })
    @GetMapping("/{exam}/subjects")
    public ResponseEntity<SubjectListResponse> listSubjects(
            @Parameter(description = "Exam key", example = "JEE") @PathVariable String exam) {
        return ResponseEntity.ok(new SubjectListResponse(exam, catalogService.listSubjects(exam)));
    }

    @Operation(summary = "List chapters of a subject")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Chapters returned"),
            @ApiResponse(responseCode = "400", description = "Unknown exam or subject")
    })
    @GetMapping("/{exam}/subjects/{subject}/chapters")
    public ResponseEntity<ChapterListResponse> listChapters(
            @Parameter(description = "Exam key", example = "JEE") @PathVariable String exam,
            @Parameter(description = "Subject", example = "Physics") @PathVariable String subject) {
        return ResponseEntity.ok(new ChapterListResponse(exam, subject, catalogService.listChapters(exam, subject)));
    }

    @Operation(summary = "Get the marking scheme of an exam")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Marking scheme returned"),
            @ApiResponse(responseCode = "400", description = "No scheme configured for the exam")
    })
    @GetMapping("/{exam}/marking-scheme")
    public ResponseEntity<MarkingSchemeResponse> getMarkingScheme(
            @Parameter(description = "Exam key", example = "NEET") @PathVariable String exam) {
        return ResponseEntity.ok(MarkingSchemeResponse.of(exam, catalogService.getMarkingScheme(exam)));
    }
}
