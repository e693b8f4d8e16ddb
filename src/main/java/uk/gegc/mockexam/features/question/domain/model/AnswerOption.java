package uk.gegc.mockexam.features.question.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * The four option keys of a multiple-choice question.
 */
public enum AnswerOption {
    A, B, C, D;

    public static final List<String> KEYS = Arrays.stream(values()).map(Enum::name).toList();

    public static boolean isValidKey(String key) {
        return key != null && KEYS.contains(key);
    }
}
