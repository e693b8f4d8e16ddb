package uk.gegc.mockexam.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record GenerationMetadata(
        String exam,
        @JsonProperty("total_questions") int totalQuestions,
        List<String> subjects,
        Map<String, Integer> requested,
        Map<String, Integer> generated,
        @JsonProperty("elapsed_ms") long elapsedMillis
) {

    public GenerationMetadata {
        subjects = List.copyOf(subjects);
        requested = Collections.unmodifiableMap(new LinkedHashMap<>(requested));
        generated = Collections.unmodifiableMap(new LinkedHashMap<>(generated));
    }
}
