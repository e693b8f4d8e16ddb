package uk.gegc.mockexam.features.question.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mockexam.features.question.domain.model.AnswerOption;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.domain.model.QuestionType;
import uk.gegc.mockexam.shared.util.TextSanitizer;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a single question from one text block of the form:
 *
 * <pre>
 * Q1. Question text
 * A) option
 * B) option
 * C) option
 * D) option
 * Answer: B
 * Solution: explanation
 * </pre>
 *
 * A numeric answer line marks the question as numerical; such blocks carry no options.
 */
@Component
@Slf4j
public class QuestionBlockParser {

    private static final Pattern LETTER_ANSWER = Pattern.compile("Answer:\\s*([A-D])", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_ANSWER = Pattern.compile("Answer:\\s*(-?\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SOLUTION = Pattern.compile("Solution:\\s*(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern QUESTION_MARKER = Pattern.compile("^Q\\d+\\.?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Map<String, Pattern> OPTION_PATTERNS = new LinkedHashMap<>();

    static {
        for (String key : AnswerOption.KEYS) {
            OPTION_PATTERNS.put(key, Pattern.compile("^[ \\t]*" + key + "\\)[ \\t]*(.*)$",
                    Pattern.CASE_INSENSITIVE | Pattern.MULTILINE));
        }
    }

    /**
     * @return the extracted record with a local {@code index} as id, or empty when the block has no question text
     */
    public Optional<QuestionRecord> parseBlock(String block, int index) {
        String remaining = block;
        QuestionType type = QuestionType.MULTIPLE_CHOICE;
        String correct = null;

        Matcher letter = LETTER_ANSWER.matcher(remaining);
        if (letter.find()) {
            correct = letter.group(1).toUpperCase();
            remaining = excise(remaining, letter);
        } else {
            Matcher numeric = NUMERIC_ANSWER.matcher(remaining);
            if (numeric.find()) {
                correct = toIntegerAnswer(numeric.group(1));
                type = QuestionType.NUMERICAL;
                remaining = excise(remaining, numeric);
            }
        }

        String solution = "";
        Matcher solutionMatcher = SOLUTION.matcher(remaining);
        if (solutionMatcher.find()) {
            solution = solutionMatcher.group(1).trim();
            remaining = excise(remaining, solutionMatcher);
        }

        Map<String, String> options = null;
        if (type == QuestionType.MULTIPLE_CHOICE) {
            options = new LinkedHashMap<>();
            for (Map.Entry<String, Pattern> entry : OPTION_PATTERNS.entrySet()) {
                Matcher option = entry.getValue().matcher(remaining);
                if (option.find()) {
                    options.put(entry.getKey(), TextSanitizer.sanitize(option.group(1)));
                    remaining = excise(remaining, option);
                }
            }
        }

        String questionText = firstQuestionLine(remaining);
        if (questionText.isEmpty()) {
            log.debug("Block {} has no question text", index);
            return Optional.empty();
        }

        return Optional.of(new QuestionRecord(
                index,
                null,
                type,
                TextSanitizer.sanitize(questionText),
                options,
                correct,
                TextSanitizer.sanitize(solution),
                null,
                null));
    }

    private static String firstQuestionLine(String text) {
        for (String rawLine : text.split("\n")) {
            String line = QUESTION_MARKER.matcher(rawLine.trim()).replaceFirst("").trim();
            if (!line.isEmpty() && !line.startsWith("Answer:") && !line.startsWith("Solution:")) {
                return line;
            }
        }
        return "";
    }

    private static String excise(String text, Matcher match) {
        return text.substring(0, match.start()) + text.substring(match.end());
    }

    // "42.0" -> "42", "-3.7" -> "-3"; no range limit
    private static String toIntegerAnswer(String raw) {
        return new BigDecimal(raw).toBigInteger().toString();
    }
}
