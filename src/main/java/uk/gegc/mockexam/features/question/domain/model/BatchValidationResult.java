package uk.gegc.mockexam.features.question.domain.model;

public record BatchValidationResult(int validCount, int invalidCount) {

    public int total() {
        return validCount + invalidCount;
    }
}
