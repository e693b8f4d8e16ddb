package uk.gegc.mockexam.features.generation.application;

import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.exception.SubjectGenerationException;

import java.util.List;

/**
 * Generates the questions of one subject through the language model.
 */
public interface SubjectQuestionGenerator {

    /**
     * Over-requests by the configured safety buffer and keeps the first {@code numQuestions} valid questions.
     * A shortfall is returned as-is.
     *
     * @return valid questions tagged with subject, difficulty and the first requested chapter;
     * ids are local to the subject
     * @throws SubjectGenerationException when the model call fails or nothing can be parsed
     */
    List<QuestionRecord> generateForSubject(String exam, String subject, List<String> chapters,
                                            int numQuestions, String difficulty);
}
