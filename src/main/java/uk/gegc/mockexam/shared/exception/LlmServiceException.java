package uk.gegc.mockexam.shared.exception;

import java.util.Map;

/**
 * Exception thrown when the LLM service encounters an error
 */
public class LlmServiceException extends ExamGenerationException {

    public LlmServiceException(String message) {
        super(ErrorKind.LLM_SERVICE, message);
    }

    public LlmServiceException(String message, Throwable cause) {
        super(ErrorKind.LLM_SERVICE, message, cause);
    }

    protected LlmServiceException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(kind, message, details, cause);
    }
}
