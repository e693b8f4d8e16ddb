package uk.gegc.mockexam.shared.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when input data or a batch of questions fails validation
 */
public class ValidationException extends ExamGenerationException {

    private final String field;

    public ValidationException(String message, String field) {
        this(message, field, null);
    }

    public ValidationException(String message, String field, Object value) {
        super(ErrorKind.VALIDATION, message, details(field, value), null);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    private static Map<String, Object> details(String field, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        if (value != null) {
            details.put("value", String.valueOf(value));
        }
        return details;
    }
}
