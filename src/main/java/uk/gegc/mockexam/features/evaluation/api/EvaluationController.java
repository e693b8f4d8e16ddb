package uk.gegc.mockexam.features.evaluation.api;

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
import uk.gegc.mockexam.features.evaluation.api.dto.EvaluateRequest;
import uk.gegc.mockexam.features.evaluation.api.dto.EvaluateResponse;
import uk.gegc.mockexam.features.evaluation.application.EvaluationService;
import uk.gegc.mockexam.features.evaluation.application.PerformanceInsightsService;
import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;

@RestController
@RequestMapping("/api/exams")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Evaluation", description = "Scoring of exam attempts")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final PerformanceInsightsService insightsService;

    @Operation(
            summary = "Evaluate an attempt",
            description = "Scores the answers with the exam's marking scheme and derives performance insights"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Attempt scored",
                    content = @Content(schema = @Schema(implementation = EvaluateResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "No questions supplied")
    })
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluateResponse> evaluate(@Valid @RequestBody EvaluateRequest request) {
        log.info("Evaluation request received for {} ({} questions)",
                request.exam(), request.questions() == null ? 0 : request.questions().size());

        EvaluationResult result = evaluationService.evaluate(request.questions(), request.userAnswers(), request.exam());
        if (request.timeTaken() != null) {
            result = result.withTimeTaken(request.timeTaken());
        }
        if (request.allScores() != null && !request.allScores().isEmpty()) {
            result = result.withPercentile(insightsService.calculatePercentile(result.totalMarks(), request.allScores()));
        }

        return ResponseEntity.ok(new EvaluateResponse(true, result, insightsService.insights(result)));
    }
}
