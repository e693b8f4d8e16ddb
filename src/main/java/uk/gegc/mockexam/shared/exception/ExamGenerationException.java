package uk.gegc.mockexam.shared.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for the generation and evaluation pipeline.
 */
public class ExamGenerationException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public ExamGenerationException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public ExamGenerationException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, Map.of(), cause);
    }

    public ExamGenerationException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        // null values are allowed in details, so Map.copyOf is not an option
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    @Override
    public String toString() {
        if (details.isEmpty()) {
            return getMessage();
        }
        return getMessage() + " | Details: " + details;
    }
}
