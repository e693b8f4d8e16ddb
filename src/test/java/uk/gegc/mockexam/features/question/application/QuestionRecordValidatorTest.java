package uk.gegc.mockexam.features.question.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.mockexam.features.question.domain.model.BatchValidationResult;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;
import uk.gegc.mockexam.features.question.domain.model.ValidationOutcome;
import uk.gegc.mockexam.shared.exception.ErrorKind;
import uk.gegc.mockexam.shared.exception.QuestionValidationException;
import uk.gegc.mockexam.shared.exception.ValidationException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.mockexam.testsupport.QuestionFixtures.mcq;
import static uk.gegc.mockexam.testsupport.QuestionFixtures.numerical;
import static uk.gegc.mockexam.testsupport.QuestionFixtures.options;
import static uk.gegc.mockexam.testsupport.QuestionFixtures.validator;

@DisplayName("QuestionRecordValidator")
class QuestionRecordValidatorTest {

    private final QuestionRecordValidator validator = validator();

    private static QuestionRecord copy(QuestionRecord base, String question, Map<String, String> options,
                                       String correct, String solution) {
        return new QuestionRecord(base.id(), base.subject(), base.type(), question, options, correct, solution,
                base.difficulty(), base.chapter());
    }

    @Nested
    @DisplayName("Multiple-choice rules")
    class MultipleChoiceRules {

        @Test
        @DisplayName("well-formed record is valid")
        void validRecord() {
            ValidationOutcome outcome = validator.validate(mcq(0, "Physics", "B"));

            assertThat(outcome.valid()).isTrue();
            assertThat(outcome.errors()).isEmpty();
        }

        @Test
        @DisplayName("missing question text is invalid")
        void missingQuestion() {
            QuestionRecord base = mcq(0, "Physics", "B");

            ValidationOutcome outcome = validator.validate(copy(base, null, base.options(), "B", base.solution()));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errors()).containsExactly("Missing required fields: question");
        }

        @Test
        @DisplayName("missing options is invalid")
        void missingOptions() {
            QuestionRecord base = mcq(0, "Physics", "B");

            ValidationOutcome outcome = validator.validate(copy(base, base.question(), null, "B", base.solution()));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errors()).containsExactly("Missing required fields: options");
        }

        @Test
        @DisplayName("missing correct answer and solution are reported together")
        void missingCorrectAndSolution() {
            QuestionRecord base = mcq(0, "Physics", "B");

            ValidationOutcome outcome = validator.validate(copy(base, base.question(), base.options(), null, null));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errors()).containsExactly("Missing required fields: correct, solution");
        }

        @Test
        @DisplayName("three options are invalid")
        void threeOptions() {
            QuestionRecord base = mcq(0, "Physics", "B");
            Map<String, String> options = options();
            options.remove("D");

            ValidationOutcome outcome = validator.validate(copy(base, base.question(), options, "B", base.solution()));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errors()).containsExactly("Missing options: D");
        }

        @Test
        @DisplayName("correct answer E is invalid")
        void correctE() {
            ValidationOutcome outcome = validator.validate(mcq(0, "Physics", "E"));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.errors()).singleElement().asString().startsWith("Invalid correct answer: E");
        }

        @Test
        @DisplayName("extra option key is rejected")
        void extraOptionKey() {
            QuestionRecord base = mcq(0, "Physics", "B");
            Map<String, String> options = options();
            options.put("E", "Ampere");

            ValidationOutcome outcome = validator.validate(copy(base, base.question(), options, "B", base.solution()));

            assertThat(outcome.errors()).containsExactly("Invalid option key: E");
        }

        @Test
        @DisplayName("option text outside 1..500 characters is rejected")
        void optionLength() {
            QuestionRecord base = mcq(0, "Physics", "B");
            Map<String, String> options = options();
            options.put("A", "");
            options.put("C", "x".repeat(501));

            ValidationOutcome outcome = validator.validate(copy(base, base.question(), options, "B", base.solution()));

            assertThat(outcome.errors()).containsExactly("Option A too short", "Option C too long");
        }

        @Test
        @DisplayName("errors accumulate instead of stopping at the first rule")
        void errorsAccumulate() {
            QuestionRecord base = mcq(0, "Physics", "B");

            ValidationOutcome outcome = validator.validate(copy(base, "Too short", base.options(), "X", "Short"));

            assertThat(outcome.errors()).hasSize(3);
            assertThat(outcome.errors()).anyMatch(error -> error.startsWith("Question too short"));
            assertThat(outcome.errors()).anyMatch(error -> error.startsWith("Solution too short"));
            assertThat(outcome.errors()).anyMatch(error -> error.startsWith("Invalid correct answer"));
        }

        @Test
        @DisplayName("question over 1000 characters is rejected")
        void questionTooLong() {
            QuestionRecord base = mcq(0, "Physics", "B");

            ValidationOutcome outcome = validator.validate(
                    copy(base, "q".repeat(1001), base.options(), "B", base.solution()));

            assertThat(outcome.errors()).containsExactly("Question too long (max 1000 chars)");
        }

        @Test
        @DisplayName("record without a type is checked as multiple-choice")
        void nullTypeIsMultipleChoice() {
            QuestionRecord base = mcq(0, "Physics", "B");
            QuestionRecord untyped = new QuestionRecord(0, "Physics", null, base.question(), null, "B",
                    base.solution(), null, null);

            assertThat(validator.validate(untyped).errors()).containsExactly("Missing required fields: options");
        }
    }

    @Nested
    @DisplayName("Numerical rules")
    class NumericalRules {

        @Test
        @DisplayName("integer answer without options is valid")
        void validNumerical() {
            assertThat(validator.validate(numerical(0, "Chemistry", 2)).valid()).isTrue();
        }

        @Test
        @DisplayName("numerical record with options is invalid")
        void numericalWithOptions() {
            QuestionRecord base = numerical(0, "Chemistry", 2);
            QuestionRecord withOptions = new QuestionRecord(0, "Chemistry", QuestionType.NUMERICAL,
                    base.question(), options(), "2", base.solution(), null, null);

            assertThat(validator.validate(withOptions).errors())
                    .containsExactly("Numerical questions must not have options");
        }

        @Test
        @DisplayName("non-integer answer is invalid")
        void nonIntegerAnswer() {
            QuestionRecord base = numerical(0, "Chemistry", 2);
            QuestionRecord letter = new QuestionRecord(0, "Chemistry", QuestionType.NUMERICAL,
                    base.question(), null, "B", base.solution(), null, null);

            assertThat(validator.validate(letter).errors())
                    .containsExactly("Invalid numerical answer: B. Must be an integer");
        }
    }

    @Nested
    @DisplayName("Raising and batch variants")
    class RaisingAndBatch {

        @Test
        @DisplayName("validateOrThrow carries the question id and every error")
        void validateOrThrow() {
            assertThatThrownBy(() -> validator.validateOrThrow(mcq(7, "Physics", "E")))
                    .isInstanceOf(QuestionValidationException.class)
                    .satisfies(e -> {
                        QuestionValidationException qve = (QuestionValidationException) e;
                        assertThat(qve.getQuestionId()).isEqualTo(7);
                        assertThat(qve.getErrors()).hasSize(1);
                        assertThat(qve.kind()).isEqualTo(ErrorKind.VALIDATION);
                    });
        }

        @Test
        @DisplayName("validateOrThrow passes a valid record")
        void validateOrThrowValid() {
            validator.validateOrThrow(mcq(1, "Physics", "A"));
        }

        @Test
        @DisplayName("validateAll counts valid and invalid records")
        void validateAllCounts() {
            BatchValidationResult result = validator.validateAll(
                    List.of(mcq(0, "Physics", "A"), mcq(1, "Physics", "E"), numerical(2, "Physics", 5)), null);

            assertThat(result.validCount()).isEqualTo(2);
            assertThat(result.invalidCount()).isEqualTo(1);
            assertThat(result.total()).isEqualTo(3);
        }

        @Test
        @DisplayName("validateAll raises when fewer than minCount records pass")
        void validateAllMinCount() {
            List<QuestionRecord> records = List.of(mcq(0, "Physics", "A"), mcq(1, "Physics", "E"));

            assertThatThrownBy(() -> validator.validateAll(records, 2))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Insufficient valid questions: 1 < 2");
        }
    }

    @Nested
    @DisplayName("User answers")
    class UserAnswers {

        @Test
        @DisplayName("null and A-D are valid, anything else is not")
        void optionAnswers() {
            assertThat(validator.isValidUserAnswer(null)).isTrue();
            assertThat(validator.isValidUserAnswer("A")).isTrue();
            assertThat(validator.isValidUserAnswer("D")).isTrue();
            assertThat(validator.isValidUserAnswer("E")).isFalse();
            assertThat(validator.isValidUserAnswer("a")).isFalse();
            assertThat(validator.isValidUserAnswer("")).isFalse();
        }

        @Test
        @DisplayName("numerical questions accept integers only")
        void numericalAnswers() {
            QuestionRecord question = numerical(0, "Chemistry", 2);

            assertThat(validator.isValidUserAnswer(question, "2")).isTrue();
            assertThat(validator.isValidUserAnswer(question, "-14")).isTrue();
            assertThat(validator.isValidUserAnswer(question, null)).isTrue();
            assertThat(validator.isValidUserAnswer(question, "B")).isFalse();
            assertThat(validator.isValidUserAnswer(question, "2.5")).isFalse();
        }
    }
}
