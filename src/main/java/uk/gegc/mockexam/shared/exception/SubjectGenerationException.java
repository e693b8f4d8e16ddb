package uk.gegc.mockexam.shared.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps an LLM or parsing failure and attributes it to one subject.
 * The kind of the underlying failure is preserved.
 */
public class SubjectGenerationException extends ExamGenerationException {

    private final String subject;

    public SubjectGenerationException(String subject, String message, ExamGenerationException cause) {
        super(cause.kind(), message, details(subject, cause), cause);
        this.subject = subject;
    }

    public SubjectGenerationException(String subject, String message, Throwable cause) {
        super(ErrorKind.LLM_SERVICE, message, Map.of("subject", subject), cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    private static Map<String, Object> details(String subject, ExamGenerationException cause) {
        Map<String, Object> details = new LinkedHashMap<>(cause.details());
        details.put("subject", subject);
        return details;
    }
}
