package uk.gegc.mockexam.features.exam.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    public static final List<String> LABELS = Arrays.stream(values()).map(Difficulty::getLabel).toList();

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact, case-sensitive lookup by label ("Easy", "Medium", "Hard").
     */
    public static Optional<Difficulty> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(difficulty -> difficulty.label.equals(label))
                .findFirst();
    }
}
