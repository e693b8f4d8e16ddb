package uk.gegc.mockexam.shared.exception;

import java.util.List;

/**
 * Exception thrown when a single question record breaks the structural rules
 */
public class QuestionValidationException extends ValidationException {

    private final Integer questionId;
    private final List<String> errors;

    public QuestionValidationException(Integer questionId, List<String> errors) {
        super("Question validation failed: " + String.join("; ", errors), "question", questionId);
        this.questionId = questionId;
        this.errors = List.copyOf(errors);
    }

    public Integer getQuestionId() {
        return questionId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
