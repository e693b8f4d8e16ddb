package uk.gegc.mockexam.features.evaluation.application;

import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.exception.ValidationException;

import java.util.List;
import java.util.Map;

public interface EvaluationService {

    /**
     * Score an attempt with the marking scheme of {@code exam}. Unknown exams use the default scheme.
     *
     * @param questions   the questions of the attempt, in presentation order
     * @param userAnswers answer per question id; missing or invalid answers count as unattempted
     * @param exam        exam key used to resolve the marking scheme
     * @throws ValidationException when {@code questions} is empty
     */
    EvaluationResult evaluate(List<QuestionRecord> questions, Map<Integer, String> userAnswers, String exam);
}
