package uk.gegc.mockexam.features.question.domain.model;

import java.util.List;

public record ValidationOutcome(boolean valid, List<String> errors) {

    public ValidationOutcome {
        errors = List.copyOf(errors);
    }

    public static ValidationOutcome of(List<String> errors) {
        return new ValidationOutcome(errors.isEmpty(), errors);
    }
}
