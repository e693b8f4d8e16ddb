package uk.gegc.mockexam.features.generation.application;

import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;
import uk.gegc.mockexam.features.generation.domain.model.GeneratedExam;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.exception.ConfigurationException;
import uk.gegc.mockexam.shared.exception.InsufficientQuestionsException;

import java.util.List;

public interface ExamGenerationService {

    /**
     * Generate questions for several subjects of one exam.
     *
     * <p>Every configuration is validated before any generation starts. A failing subject
     * yields an empty list and a failure entry; the others continue. Ids are assigned
     * sequentially from 0 in subject order.
     *
     * @param exam     exam key
     * @param subjects subject configurations in output order; empty chapter lists mean the full syllabus
     * @throws ConfigurationException        when the exam or any subject configuration is invalid
     * @throws InsufficientQuestionsException when no subject produced a question
     */
    GeneratedExam generate(String exam, List<SubjectConfig> subjects);

    /**
     * Convenience wrapper around {@link #generate} for a single subject.
     */
    List<QuestionRecord> generateSingleSubject(String exam, String subject, List<String> chapters,
                                               int numQuestions, String difficulty);
}
