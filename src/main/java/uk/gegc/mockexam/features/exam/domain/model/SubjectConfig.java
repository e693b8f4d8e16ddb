package uk.gegc.mockexam.features.exam.domain.model;

import java.util.List;

/**
 * Generation request for one subject. An empty chapter list stands for the full syllabus.
 */
public record SubjectConfig(String subject, List<String> chapters, int numQuestions, String difficulty) {

    public SubjectConfig {
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public SubjectConfig withChapters(List<String> newChapters) {
        return new SubjectConfig(subject, newChapters, numQuestions, difficulty);
    }
}
