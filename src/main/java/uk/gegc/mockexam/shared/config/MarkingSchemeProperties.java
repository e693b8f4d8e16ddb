package uk.gegc.mockexam.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.exam.domain.model.MarkingScheme;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-exam marking schemes
 */
@Component
@ConfigurationProperties(prefix = "exam.marking")
@Data
public class MarkingSchemeProperties {

    /**
     * Exam whose scheme is used for unknown exams
     */
    private String defaultExam = "JEE";

    /**
     * Scheme per exam key
     */
    private Map<String, MarkingScheme> schemes = new LinkedHashMap<>();

    /**
     * Always resolves: unknown exams get the default exam's scheme, then 4/-1/0.
     */
    public MarkingScheme resolve(String exam) {
        MarkingScheme scheme = exam == null ? null : schemes.get(exam);
        if (scheme == null) {
            scheme = schemes.get(defaultExam);
        }
        return scheme == null ? MarkingScheme.DEFAULT : scheme;
    }

    public boolean isConfigured(String exam) {
        return exam != null && schemes.containsKey(exam);
    }
}
