package uk.gegc.mockexam.features.question.domain.model;

import java.util.List;

/**
 * Outcome of parsing one model response.
 *
 * @param questions the valid records, in parse order
 * @param strategy  strategy that produced the candidate blocks
 * @param parsed    candidates kept after truncation
 * @param invalid   candidates dropped by validation
 */
public record ParseReport(List<QuestionRecord> questions, ParseStrategy strategy, int parsed, int invalid) {

    public ParseReport {
        questions = List.copyOf(questions);
    }

    public int valid() {
        return questions.size();
    }

    /**
     * Share of parsed candidates that passed validation, 0 when nothing was parsed.
     */
    public double successRate() {
        return parsed == 0 ? 0.0 : (double) questions.size() / parsed;
    }
}
