package uk.gegc.mockexam.features.question.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.domain.model.AnswerOption;
import uk.gegc.mockexam.features.question.domain.model.BatchValidationResult;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.ValidationOutcome;
import uk.gegc.mockexam.features.question.infra.factory.QuestionRuleSetFactory;
import uk.gegc.mockexam.shared.exception.QuestionValidationException;
import uk.gegc.mockexam.shared.exception.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural validation of question records. The rule set is picked by question type.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionRecordValidator {

    private static final Pattern INTEGER_ANSWER = Pattern.compile("-?\\d+");

    private final QuestionRuleSetFactory ruleSetFactory;

    public ValidationOutcome validate(QuestionRecord record) {
        if (record == null) {
            return ValidationOutcome.of(List.of("Question record is missing"));
        }
        List<String> errors = ruleSetFactory.getRuleSet(record.type()).check(record);
        if (!errors.isEmpty()) {
            log.debug("Question {} failed validation: {}", record.id(), errors);
        }
        return ValidationOutcome.of(errors);
    }

    /**
     * @throws QuestionValidationException carrying every rule violation of the record
     */
    public void validateOrThrow(QuestionRecord record) {
        ValidationOutcome outcome = validate(record);
        if (!outcome.valid()) {
            throw new QuestionValidationException(record == null ? null : record.id(), outcome.errors());
        }
    }

    /**
     * Counts valid and invalid records.
     *
     * @param minCount when not null, the minimum number of records that must pass
     * @throws ValidationException when fewer than {@code minCount} records are valid
     */
    public BatchValidationResult validateAll(List<QuestionRecord> records, Integer minCount) {
        int valid = 0;
        int invalid = 0;
        for (QuestionRecord record : records) {
            if (validate(record).valid()) {
                valid++;
            } else {
                invalid++;
            }
        }

        log.info("Batch validation: {} valid, {} invalid", valid, invalid);

        if (minCount != null && valid < minCount) {
            throw new ValidationException(
                    "Insufficient valid questions: " + valid + " < " + minCount,
                    "questions",
                    valid);
        }
        return new BatchValidationResult(valid, invalid);
    }

    /**
     * A user answer is acceptable when it is absent or one of the option keys.
     */
    public boolean isValidUserAnswer(String answer) {
        return answer == null || AnswerOption.isValidKey(answer);
    }

    /**
     * Numerical questions take an integer answer instead of an option key.
     */
    public boolean isValidUserAnswer(QuestionRecord question, String answer) {
        if (question == null || !question.numerical() || answer == null) {
            return isValidUserAnswer(answer);
        }
        return INTEGER_ANSWER.matcher(answer.trim()).matches();
    }
}
