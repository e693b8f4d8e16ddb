package uk.gegc.mockexam.features.question.infra.parser;

import uk.gegc.mockexam.features.question.domain.model.ParseReport;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.exception.InsufficientQuestionsException;
import uk.gegc.mockexam.shared.exception.ParsingException;

import java.util.List;

/**
 * Turns free-form model output into validated question records
 */
public interface QuestionResponseParser {

    /**
     * Parse model output into valid question records
     *
     * @param rawText       the model output
     * @param subject       subject stamped on every record
     * @param expectedCount when not null, candidates beyond this count are dropped before validation
     * @param strict        turn a low success rate or a shortfall into failures instead of warnings
     * @return valid records with their local index as id
     * @throws ParsingException              if nothing can be extracted, or strict parsing sees a low success rate
     * @throws InsufficientQuestionsException if strict and fewer valid records than expected remain
     */
    List<QuestionRecord> parse(String rawText, String subject, Integer expectedCount, boolean strict);

    /**
     * Same as {@link #parse} but also reports the strategy used and the parse/validation counts
     */
    ParseReport parseWithReport(String rawText, String subject, Integer expectedCount, boolean strict);
}
