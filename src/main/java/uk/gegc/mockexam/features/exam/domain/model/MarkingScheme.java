package uk.gegc.mockexam.features.exam.domain.model;

/**
 * Marks awarded per question outcome. Penalties are negative and may be fractional.
 */
public record MarkingScheme(double correct, double wrong, double unattempted) {

    public static final MarkingScheme DEFAULT = new MarkingScheme(4, -1, 0);
}
