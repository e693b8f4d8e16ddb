package uk.gegc.mockexam.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;

import java.util.List;

/**
 * Numerical questions carry no options and an integer answer.
 */
@Component
public class NumericalRuleSet extends QuestionRuleSet {

    @Override
    public QuestionType supportedType() {
        return QuestionType.NUMERICAL;
    }

    @Override
    protected void checkTypeSpecific(QuestionRecord record, List<String> errors) {
        if (record.options() != null && !record.options().isEmpty()) {
            errors.add("Numerical questions must not have options");
        }
        if (record.correct() != null && record.numericalAnswer() == null) {
            errors.add("Invalid numerical answer: " + record.correct() + ". Must be an integer");
        }
    }
}
