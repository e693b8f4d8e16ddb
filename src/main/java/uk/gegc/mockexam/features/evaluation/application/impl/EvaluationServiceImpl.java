package uk.gegc.mockexam.features.evaluation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.evaluation.application.EvaluationService;
import uk.gegc.mockexam.features.evaluation.domain.model.Accuracy;
import uk.gegc.mockexam.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.mockexam.features.evaluation.domain.model.QuestionDetail;
import uk.gegc.mockexam.features.evaluation.domain.model.SubjectResult;
import uk.gegc.mockexam.features.exam.domain.model.MarkingScheme;
import uk.gegc.mockexam.features.question.application.QuestionRecordValidator;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.config.MarkingSchemeProperties;
import uk.gegc.mockexam.shared.exception.ValidationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationServiceImpl implements EvaluationService {

    private static final String UNKNOWN_SUBJECT = "Unknown";

    private final MarkingSchemeProperties markingSchemes;
    private final QuestionRecordValidator questionValidator;

    @Override
    public EvaluationResult evaluate(List<QuestionRecord> questions, Map<Integer, String> userAnswers, String exam) {
        if (questions == null || questions.isEmpty()) {
            throw new ValidationException("Questions list cannot be empty", "questions");
        }
        Map<Integer, String> answers = userAnswers == null ? Map.of() : userAnswers;
        log.info("Starting evaluation for {} with {} questions", exam, questions.size());

        if (!markingSchemes.isConfigured(exam)) {
            log.warn("No marking scheme for exam {}, using the default scheme", exam);
        }
        MarkingScheme scheme = markingSchemes.resolve(exam);

        double totalMarks = 0.0;
        double positiveMarks = 0.0;
        double negativeMarks = 0.0;
        int correctCount = 0;
        int wrongCount = 0;
        int unattemptedCount = 0;

        Map<String, SubjectTally> tallies = new LinkedHashMap<>();
        List<QuestionDetail> details = new ArrayList<>(questions.size());

        for (QuestionRecord question : questions) {
            String subject = question.subject() == null ? UNKNOWN_SUBJECT : question.subject();
            String userAnswer = question.id() == null ? null : answers.get(question.id());

            if (!questionValidator.isValidUserAnswer(question, userAnswer)) {
                log.warn("Invalid user answer for Q{}: {}", question.id(), userAnswer);
                userAnswer = null;
            }

            SubjectTally tally = tallies.computeIfAbsent(subject, key -> new SubjectTally());
            double marks;
            boolean answeredCorrectly = false;

            if (userAnswer == null) {
                marks = scheme.unattempted();
                unattemptedCount++;
                tally.unattempted++;
            } else if (matches(question, userAnswer)) {
                marks = scheme.correct();
                positiveMarks += marks;
                correctCount++;
                tally.correct++;
                answeredCorrectly = true;
            } else {
                marks = scheme.wrong();
                negativeMarks += Math.abs(marks);
                wrongCount++;
                tally.wrong++;
            }

            totalMarks += marks;
            tally.total++;
            tally.marks += marks;
            tally.maxMarks += scheme.correct();

            details.add(new QuestionDetail(
                    question.id(),
                    subject,
                    Objects.requireNonNullElse(question.question(), ""),
                    userAnswer,
                    question.correct(),
                    answeredCorrectly,
                    marks,
                    Objects.requireNonNullElse(question.solution(), "")));
        }

        int attempted = correctCount + wrongCount;
        double accuracy = Accuracy.percent(correctCount, attempted);

        List<SubjectResult> subjectResults = new ArrayList<>(tallies.size());
        tallies.forEach((subject, tally) -> subjectResults.add(tally.toResult(subject)));

        log.info("Evaluation complete: {} marks, {}/{} correct ({}% accuracy)",
                totalMarks, correctCount, questions.size(), accuracy);

        return new EvaluationResult(totalMarks, positiveMarks, negativeMarks, questions.size(), attempted,
                correctCount, wrongCount, unattemptedCount, accuracy, subjectResults, details, null, null);
    }

    private static boolean matches(QuestionRecord question, String userAnswer) {
        if (question.numerical()) {
            BigInteger expected = question.numericalAnswer();
            return expected != null && expected.equals(new BigInteger(userAnswer.trim()));
        }
        return userAnswer.equals(question.correct());
    }

    private static final class SubjectTally {
        private int total;
        private int correct;
        private int wrong;
        private int unattempted;
        private double marks;
        private double maxMarks;

        SubjectResult toResult(String subject) {
            return new SubjectResult(subject, total, correct + wrong, correct, wrong, unattempted, marks, maxMarks);
        }
    }
}
