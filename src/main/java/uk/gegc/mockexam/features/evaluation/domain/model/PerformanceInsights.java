package uk.gegc.mockexam.features.evaluation.domain.model;

import java.util.List;

public record PerformanceInsights(List<String> strengths, List<String> weaknesses, List<String> recommendations) {

    public PerformanceInsights {
        strengths = List.copyOf(strengths);
        weaknesses = List.copyOf(weaknesses);
        recommendations = List.copyOf(recommendations);
    }
}
