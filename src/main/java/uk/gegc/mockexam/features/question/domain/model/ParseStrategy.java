package uk.gegc.mockexam.features.question.domain.model;

/**
 * Block-splitting strategy that produced a parse result.
 */
public enum ParseStrategy {
    /** Split before each line-leading {@code Q<n>.} marker. */
    PRIMARY,
    /** Split on blank lines or any {@code Q<n>} marker, with stricter per-block filtering. */
    FALLBACK
}
