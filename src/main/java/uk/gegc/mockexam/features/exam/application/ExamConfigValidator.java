package uk.gegc.mockexam.features.exam.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.exam.domain.model.Difficulty;
import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;
import uk.gegc.mockexam.features.exam.infra.SyllabusRegistry;
import uk.gegc.mockexam.shared.exception.ConfigurationException;

import java.util.List;

/**
 * Checks generation input against the syllabus. Every failure is a {@link ConfigurationException}.
 */
@Component
@RequiredArgsConstructor
public class ExamConfigValidator {

    public static final int MIN_QUESTIONS_PER_SUBJECT = 1;
    public static final int MAX_QUESTIONS_PER_SUBJECT = 100;

    private final SyllabusRegistry syllabus;

    public void validateExam(String exam) {
        if (!syllabus.isValidExam(exam)) {
            throw new ConfigurationException(
                    "Invalid exam type. Must be one of: " + String.join(", ", syllabus.exams()),
                    "exam", exam, syllabus.exams());
        }
    }

    public void validateSubject(String exam, String subject) {
        if (!syllabus.isValidSubject(exam, subject)) {
            throw new ConfigurationException(
                    "Invalid subject '" + subject + "' for " + exam,
                    "subject", subject, syllabus.subjects(exam));
        }
    }

    public void validateDifficulty(String difficulty) {
        if (Difficulty.fromLabel(difficulty).isEmpty()) {
            throw new ConfigurationException(
                    "Invalid difficulty level. Must be one of: " + String.join(", ", Difficulty.LABELS),
                    "difficulty", difficulty, Difficulty.LABELS);
        }
    }

    public void validateNumQuestions(int numQuestions) {
        if (numQuestions < MIN_QUESTIONS_PER_SUBJECT || numQuestions > MAX_QUESTIONS_PER_SUBJECT) {
            throw new ConfigurationException(
                    "Number of questions must be between " + MIN_QUESTIONS_PER_SUBJECT
                            + " and " + MAX_QUESTIONS_PER_SUBJECT,
                    "num_questions", numQuestions);
        }
    }

    public void validateChapters(String exam, String subject, List<String> chapters) {
        if (chapters == null || chapters.isEmpty()) {
            throw new ConfigurationException("At least one chapter is required for " + subject, "chapters", chapters);
        }
        for (String chapter : chapters) {
            if (!syllabus.isValidChapter(exam, subject, chapter)) {
                throw new ConfigurationException(
                        "Invalid chapter '" + chapter + "' for " + exam + " " + subject,
                        "chapters", chapter, syllabus.chapters(exam, subject));
            }
        }
    }

    /**
     * Validates subject, count, difficulty and chapters, in that order.
     */
    public void validateSubjectConfig(String exam, SubjectConfig config) {
        validateSubject(exam, config.subject());
        validateNumQuestions(config.numQuestions());
        validateDifficulty(config.difficulty());
        validateChapters(exam, config.subject(), config.chapters());
    }
}
