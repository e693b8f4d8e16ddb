package uk.gegc.mockexam.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.domain.model.AnswerOption;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;

import java.util.List;
import java.util.Map;

@Component
public class MultipleChoiceRuleSet extends QuestionRuleSet {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    protected List<String> missingFields(QuestionRecord record) {
        List<String> missing = super.missingFields(record);
        if (record.options() == null) {
            // keep the canonical field order: id, subject, question, options, correct, solution
            int index = missing.indexOf("correct");
            if (index < 0) {
                index = missing.indexOf("solution");
            }
            if (index < 0) {
                missing.add("options");
            } else {
                missing.add(index, "options");
            }
        }
        return missing;
    }

    @Override
    protected void checkTypeSpecific(QuestionRecord record, List<String> errors) {
        Map<String, String> options = record.options();
        if (options != null) {
            List<String> missingOptions = AnswerOption.KEYS.stream()
                    .filter(key -> !options.containsKey(key))
                    .toList();
            if (!missingOptions.isEmpty()) {
                errors.add("Missing options: " + String.join(", ", missingOptions));
            }

            options.forEach((key, text) -> {
                if (!AnswerOption.isValidKey(key)) {
                    errors.add("Invalid option key: " + key);
                }
                if (text == null) {
                    errors.add("Option " + key + " must be a string");
                } else if (text.length() < MIN_OPTION_LENGTH) {
                    errors.add("Option " + key + " too short");
                } else if (text.length() > MAX_OPTION_LENGTH) {
                    errors.add("Option " + key + " too long");
                }
            });
        }

        String correct = record.correct();
        if (correct != null && !AnswerOption.isValidKey(correct)) {
            errors.add("Invalid correct answer: " + correct + ". Must be one of " + AnswerOption.KEYS);
        }
    }
}
