package uk.gegc.mockexam.shared.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when fewer valid questions are available than were requested.
 */
public class InsufficientQuestionsException extends ExamGenerationException {

    private final int requested;
    private final int generated;
    private final String subject;

    public InsufficientQuestionsException(int requested, int generated, String subject) {
        super(ErrorKind.INSUFFICIENT_QUESTIONS,
                "Insufficient questions: requested " + requested + ", generated " + generated,
                details(requested, generated, subject),
                null);
        this.requested = requested;
        this.generated = generated;
        this.subject = subject;
    }

    public InsufficientQuestionsException(int requested, int generated) {
        this(requested, generated, null);
    }

    public int getRequested() {
        return requested;
    }

    public int getGenerated() {
        return generated;
    }

    public String getSubject() {
        return subject;
    }

    private static Map<String, Object> details(int requested, int generated, String subject) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested", requested);
        details.put("generated", generated);
        if (subject != null) {
            details.put("subject", subject);
        }
        return details;
    }
}
