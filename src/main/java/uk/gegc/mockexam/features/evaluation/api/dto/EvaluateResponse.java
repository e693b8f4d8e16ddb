package uk.gegc.mockexam.features.evaluation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.evaluation.domain.model.PerformanceInsights;

@Schema(name = "EvaluateResponse", description = "Scored attempt and insights")
public record EvaluateResponse(
        @Schema(description = "Always true for a successful call", example = "true")
        boolean success,

        @Schema(description = "Marks, counts and per-question details")
        EvaluationResult result,

        @Schema(description = "Strengths, weaknesses and recommendations")
        PerformanceInsights insights
) {
}
