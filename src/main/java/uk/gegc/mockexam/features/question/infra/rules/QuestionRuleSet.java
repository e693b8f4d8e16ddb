package uk.gegc.mockexam.features.question.infra.rules;

import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural rules for one question type. Every rule is checked; errors accumulate.
 */
public abstract class QuestionRuleSet {

    public static final int MIN_QUESTION_LENGTH = 10;
    public static final int MAX_QUESTION_LENGTH = 1000;
    public static final int MIN_OPTION_LENGTH = 1;
    public static final int MAX_OPTION_LENGTH = 500;
    public static final int MIN_SOLUTION_LENGTH = 10;

    /**
     * Returns the question type that this rule set supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    public List<String> check(QuestionRecord record) {
        List<String> errors = new ArrayList<>();

        List<String> missing = missingFields(record);
        if (!missing.isEmpty()) {
            errors.add("Missing required fields: " + String.join(", ", missing));
        }

        String text = record.question();
        if (text != null) {
            if (text.length() < MIN_QUESTION_LENGTH) {
                errors.add("Question too short (min " + MIN_QUESTION_LENGTH + " chars)");
            } else if (text.length() > MAX_QUESTION_LENGTH) {
                errors.add("Question too long (max " + MAX_QUESTION_LENGTH + " chars)");
            }
        }

        String solution = record.solution();
        if (solution != null && solution.length() < MIN_SOLUTION_LENGTH) {
            errors.add("Solution too short (min " + MIN_SOLUTION_LENGTH + " chars)");
        }

        checkTypeSpecific(record, errors);
        return errors;
    }

    protected List<String> missingFields(QuestionRecord record) {
        List<String> missing = new ArrayList<>();
        if (record.id() == null) missing.add("id");
        if (record.subject() == null) missing.add("subject");
        if (record.question() == null) missing.add("question");
        if (record.correct() == null) missing.add("correct");
        if (record.solution() == null) missing.add("solution");
        return missing;
    }

    protected abstract void checkTypeSpecific(QuestionRecord record, List<String> errors);
}
