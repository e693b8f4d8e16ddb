package uk.gegc.mockexam.features.question.infra.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.application.QuestionRecordValidator;
import uk.gegc.mockexam.features.question.domain.model.ParseReport;
import uk.gegc.mockexam.features.question.domain.model.ParseStrategy;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.ValidationOutcome;
import uk.gegc.mockexam.shared.config.GenerationProperties;
import uk.gegc.mockexam.shared.exception.InsufficientQuestionsException;
import uk.gegc.mockexam.shared.exception.ParsingException;
import uk.gegc.mockexam.shared.util.TextSanitizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Regex-based parser for the numbered question format requested by the prompt templates
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionResponseParserImpl implements QuestionResponseParser {

    private static final Pattern PRIMARY_SPLIT = Pattern.compile("\\n(?=Q\\d+\\.)");
    private static final Pattern FALLBACK_SPLIT = Pattern.compile("\\n\\s*\\n+|(?=Q\\d+)");
    private static final int PREVIEW_LENGTH = 120;

    private final QuestionBlockParser blockParser;
    private final QuestionRecordValidator validator;
    private final GenerationProperties generationProperties;

    @Override
    public List<QuestionRecord> parse(String rawText, String subject, Integer expectedCount, boolean strict) {
        return parseWithReport(rawText, subject, expectedCount, strict).questions();
    }

    @Override
    public ParseReport parseWithReport(String rawText, String subject, Integer expectedCount, boolean strict) {
        if (rawText == null || rawText.isBlank()) {
            log.error("Empty model output received for {}", subject);
            throw new ParsingException("Empty LLM output", rawText, subject);
        }

        log.info("Parsing model output for {} ({} chars)", subject, rawText.length());
        log.debug("Output preview: {}", TextSanitizer.sanitize(rawText, PREVIEW_LENGTH));

        ParseStrategy strategy = ParseStrategy.PRIMARY;
        List<QuestionRecord> candidates = parsePrimary(rawText);
        log.info("Primary parsing extracted {} questions", candidates.size());

        if (candidates.isEmpty()) {
            log.warn("Primary parsing found no questions for {}, trying fallback", subject);
            strategy = ParseStrategy.FALLBACK;
            candidates = parseFallback(rawText);
            log.info("Fallback parsing extracted {} questions", candidates.size());
        }

        if (candidates.isEmpty()) {
            log.error("No questions could be parsed for {}", subject);
            throw new ParsingException("Failed to parse any questions from LLM output", rawText, subject);
        }

        if (expectedCount != null && candidates.size() > expectedCount) {
            log.warn("Truncating parsed questions: got {}, limiting to {}", candidates.size(), expectedCount);
            candidates = candidates.subList(0, expectedCount);
        }

        List<QuestionRecord> valid = new ArrayList<>();
        int invalid = 0;
        for (int i = 0; i < candidates.size(); i++) {
            QuestionRecord record = candidates.get(i).withId(i).withSubject(subject);
            ValidationOutcome outcome = validator.validate(record);
            if (outcome.valid()) {
                valid.add(record);
            } else {
                invalid++;
                log.warn("Question {} failed validation: {}", i, outcome.errors());
            }
        }
        log.info("Validation complete: {} valid, {} invalid", valid.size(), invalid);

        ParseReport report = new ParseReport(valid, strategy, candidates.size(), invalid);

        double threshold = generationProperties.getMinParseSuccessRate();
        if (report.successRate() < threshold) {
            String message = String.format("Low parsing success rate: %.1f%% (threshold: %.1f%%)",
                    report.successRate() * 100, threshold * 100);
            if (strict) {
                throw new ParsingException(message, rawText, subject);
            }
            log.warn("{} for {}", message, subject);
        }

        if (expectedCount != null && valid.size() < expectedCount) {
            log.warn("Insufficient questions for {}: expected {}, got {}", subject, expectedCount, valid.size());
            if (strict) {
                throw new InsufficientQuestionsException(expectedCount, valid.size(), subject);
            }
        }

        return report;
    }

    private List<QuestionRecord> parsePrimary(String rawText) {
        List<QuestionRecord> questions = new ArrayList<>();
        int index = 0;
        for (String block : PRIMARY_SPLIT.split(rawText.strip())) {
            if (block.isBlank()) {
                continue;
            }
            blockParser.parseBlock(block.strip(), index++).ifPresent(questions::add);
        }
        return questions;
    }

    private List<QuestionRecord> parseFallback(String rawText) {
        int minLength = generationProperties.getFallbackMinBlockLength();
        int minOptions = generationProperties.getFallbackMinOptions();

        List<QuestionRecord> questions = new ArrayList<>();
        int index = 0;
        for (String block : FALLBACK_SPLIT.split(rawText)) {
            String trimmed = block.strip();
            if (trimmed.isEmpty() || block.length() <= minLength) {
                continue;
            }
            Optional<QuestionRecord> parsed = blockParser.parseBlock(trimmed, index++);
            if (parsed.isPresent() && parsed.get().options() != null && parsed.get().options().size() >= minOptions) {
                questions.add(parsed.get());
            }
        }
        return questions;
    }
}
