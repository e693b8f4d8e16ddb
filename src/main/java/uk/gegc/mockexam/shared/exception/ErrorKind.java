package uk.gegc.mockexam.shared.exception;

/**
 * Discriminator carried by every {@link ExamGenerationException}.
 * Callers branch on the kind value rather than on the exception subclass.
 */
public enum ErrorKind {
    CONFIGURATION,
    PARSING,
    VALIDATION,
    INSUFFICIENT_QUESTIONS,
    LLM_SERVICE,
    RATE_LIMIT,
    TIMEOUT
}
