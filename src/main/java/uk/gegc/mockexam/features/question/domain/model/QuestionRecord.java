package uk.gegc.mockexam.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single exam question.
 *
 * <p>Created by the parser with a batch-local {@code id}; the generator attaches subject,
 * chapter and difficulty, and the exam coordinator replaces {@code id} with the batch-wide one.
 * Enrichment always returns a copy.
 *
 * <p>{@code correct} holds an option letter for multiple-choice questions and the decimal
 * digits of the integer answer for numerical ones.
 */
@Schema(name = "QuestionRecord", description = "Generated exam question")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "subject", "type", "question", "options", "correct", "solution", "difficulty", "chapter"})
public record QuestionRecord(
        @Schema(description = "Batch-unique sequential id", example = "0")
        Integer id,

        @Schema(description = "Subject the question belongs to", example = "Physics")
        String subject,

        @Schema(description = "Question type", example = "mcq")
        QuestionType type,

        @Schema(description = "Question text", example = "What is the SI unit of force?")
        String question,

        @Schema(description = "Options keyed A to D (multiple-choice only)")
        Map<String, String> options,

        @Schema(description = "Option letter or integer answer", example = "B")
        @JsonSerialize(using = CorrectAnswerSerializer.class)
        String correct,

        @Schema(description = "Explanation of the answer")
        String solution,

        @Schema(description = "Difficulty label", example = "Medium")
        String difficulty,

        @Schema(description = "Chapter the question was generated for", example = "Laws of Motion")
        String chapter
) {

    public QuestionRecord {
        if (options != null) {
            options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }
    }

    public boolean numerical() {
        return type == QuestionType.NUMERICAL;
    }

    /**
     * Integer answer of a numerical question, or {@code null} when the answer is not an integer.
     */
    public BigInteger numericalAnswer() {
        if (correct == null) {
            return null;
        }
        try {
            return new BigInteger(correct.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public QuestionRecord withId(Integer newId) {
        return new QuestionRecord(newId, subject, type, question, options, correct, solution, difficulty, chapter);
    }

    public QuestionRecord withSubject(String newSubject) {
        return new QuestionRecord(id, newSubject, type, question, options, correct, solution, difficulty, chapter);
    }

    public QuestionRecord withMetadata(String newDifficulty, String newChapter) {
        return new QuestionRecord(id, subject, type, question, options, correct, solution, newDifficulty, newChapter);
    }
}
