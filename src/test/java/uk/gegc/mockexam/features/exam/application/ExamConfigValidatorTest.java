package uk.gegc.mockexam.features.exam.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;
import uk.gegc.mockexam.features.exam.infra.SyllabusRegistry;
import uk.gegc.mockexam.shared.exception.ConfigurationException;
import uk.gegc.mockexam.shared.exception.ErrorKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExamConfigValidator")
class ExamConfigValidatorTest {

    private final ExamConfigValidator validator = new ExamConfigValidator(
            new SyllabusRegistry(new DefaultResourceLoader(), new ObjectMapper(), "classpath:exam/syllabus.json"));

    @Nested
    @DisplayName("Single checks")
    class SingleChecks {

        @Test
        @DisplayName("unknown exam lists the valid ones")
        void unknownExam() {
            assertThatThrownBy(() -> validator.validateExam("SAT"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Invalid exam type. Must be one of: JEE, NEET, UPSC")
                    .satisfies(e -> {
                        ConfigurationException ex = (ConfigurationException) e;
                        assertThat(ex.kind()).isEqualTo(ErrorKind.CONFIGURATION);
                        assertThat(ex.getField()).isEqualTo("exam");
                        assertThat(ex.details()).containsEntry("allowed", List.of("JEE", "NEET", "UPSC"));
                    });
        }

        @Test
        @DisplayName("subject must belong to the exam")
        void subjectOfOtherExam() {
            assertThatThrownBy(() -> validator.validateSubject("JEE", "Botany"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Invalid subject 'Botany' for JEE");
        }

        @ParameterizedTest
        @ValueSource(strings = {"easy", "MEDIUM", "Extreme", ""})
        @DisplayName("difficulty labels are exact")
        void invalidDifficulty(String difficulty) {
            assertThatThrownBy(() -> validator.validateDifficulty(difficulty))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Invalid difficulty level. Must be one of: Easy, Medium, Hard");
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -3, 101})
        @DisplayName("question count outside 1 to 100 is rejected")
        void invalidCount(int count) {
            assertThatThrownBy(() -> validator.validateNumQuestions(count))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Number of questions must be between 1 and 100");
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 50, 100})
        @DisplayName("question count bounds are inclusive")
        void validCount(int count) {
            assertThatCode(() -> validator.validateNumQuestions(count)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("first unknown chapter is reported")
        void unknownChapter() {
            assertThatThrownBy(() -> validator.validateChapters("JEE", "Physics",
                    List.of("Kinematics", "String Theory", "Alchemy")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Invalid chapter 'String Theory' for JEE Physics");
        }
    }

    @Nested
    @DisplayName("Subject configuration")
    class SubjectConfiguration {

        @Test
        @DisplayName("a valid configuration passes")
        void validConfig() {
            SubjectConfig config = new SubjectConfig("Zoology", List.of("Animal Kingdom"), 20, "Hard");

            assertThatCode(() -> validator.validateSubjectConfig("NEET", config)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("subject is checked before the question count")
        void subjectCheckedFirst() {
            SubjectConfig config = new SubjectConfig("Astronomy", List.of("Stars"), 500, "Nope");

            assertThatThrownBy(() -> validator.validateSubjectConfig("JEE", config))
                    .hasMessage("Invalid subject 'Astronomy' for JEE");
        }

        @Test
        @DisplayName("question count is checked before difficulty and chapters")
        void countCheckedBeforeDifficulty() {
            SubjectConfig config = new SubjectConfig("Physics", List.of("Stars"), 500, "Nope");

            assertThatThrownBy(() -> validator.validateSubjectConfig("JEE", config))
                    .hasMessage("Number of questions must be between 1 and 100");
        }

        @Test
        @DisplayName("difficulty is checked before chapters")
        void difficultyCheckedBeforeChapters() {
            SubjectConfig config = new SubjectConfig("Physics", List.of("Stars"), 10, "Nope");

            assertThatThrownBy(() -> validator.validateSubjectConfig("JEE", config))
                    .hasMessage("Invalid difficulty level. Must be one of: Easy, Medium, Hard");
        }
    }
}
