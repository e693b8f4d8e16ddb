package uk.gegc.mockexam.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.mockexam.features.generation.api.dto.GenerateExamRequest;
import uk.gegc.mockexam.features.generation.api.dto.GenerateExamResponse;
import uk.gegc.mockexam.features.generation.application.ExamGenerationService;
import uk.gegc.mockexam.features.generation.domain.model.GeneratedExam;

/**
 * Controller for mock exam generation
 */
@RestController
@RequestMapping("/api/exams")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Exam Generation", description = "LLM-backed question paper generation")
public class ExamGenerationController {

    private final ExamGenerationService examGenerationService;

    @Operation(
            summary = "Generate a mock exam",
            description = "Generates questions for every requested subject. Subjects that fail are returned empty and listed under failures."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Questions generated",
                    content = @Content(schema = @Schema(implementation = GenerateExamResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Invalid exam or subject configuration"),
            @ApiResponse(responseCode = "422", description = "No subject produced any question")
    })
    @PostMapping("/generate")
    public ResponseEntity<GenerateExamResponse> generate(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Exam and per-subject settings",
                    required = true
            )
            @Valid @RequestBody GenerateExamRequest request) {
        log.info("Generation request received for {} with subjects {}", request.exam(), request.subjectData().keySet());

        GeneratedExam exam = examGenerationService.generate(request.exam(), request.toSubjectConfigs());
        return ResponseEntity.ok(GenerateExamResponse.from(exam));
    }
}
