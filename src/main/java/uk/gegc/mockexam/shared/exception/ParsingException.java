package uk.gegc.mockexam.shared.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when no question can be extracted from model output,
 * or when strict parsing sees too low a success rate.
 */
public class ParsingException extends ExamGenerationException {

    private final String subject;

    public ParsingException(String message, String rawText, String subject) {
        super(ErrorKind.PARSING, message, details(rawText, subject), null);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    private static Map<String, Object> details(String rawText, String subject) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subject", subject);
        details.put("textLength", rawText == null ? 0 : rawText.length());
        return details;
    }
}
