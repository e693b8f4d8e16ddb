package uk.gegc.mockexam.shared.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when an exam, subject, chapter, difficulty or question count is not acceptable.
 * Always fatal to the call and raised before any generation work starts.
 */
public class ConfigurationException extends ExamGenerationException {

    private final String field;

    public ConfigurationException(String message, String field, Object value) {
        this(message, field, value, List.of());
    }

    public ConfigurationException(String message, String field, Object value, List<String> allowedValues) {
        super(ErrorKind.CONFIGURATION, message, details(field, value, allowedValues), null);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    private static Map<String, Object> details(String field, Object value, List<String> allowedValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("value", value == null ? null : String.valueOf(value));
        if (!allowedValues.isEmpty()) {
            details.put("allowed", List.copyOf(allowedValues));
        }
        return details;
    }
}
