package uk.gegc.mockexam.features.generation.domain.model;

import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a multi-subject generation run.
 *
 * @param questions all questions in subject order, ids 0..n-1
 * @param bySubject the same questions grouped by subject; failed subjects map to an empty list
 * @param failures  failure message per failed subject
 */
public record GeneratedExam(
        List<QuestionRecord> questions,
        Map<String, List<QuestionRecord>> bySubject,
        Map<String, String> failures,
        GenerationMetadata metadata
) {

    public GeneratedExam {
        questions = List.copyOf(questions);
        Map<String, List<QuestionRecord>> grouped = new LinkedHashMap<>();
        bySubject.forEach((subject, records) -> grouped.put(subject, List.copyOf(records)));
        bySubject = Collections.unmodifiableMap(grouped);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
