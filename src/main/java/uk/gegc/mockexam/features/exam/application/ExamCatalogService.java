package uk.gegc.mockexam.features.exam.application;

import uk.gegc.mockexam.features.exam.domain.model.MarkingScheme;

import java.util.List;

/**
 * Read-only queries over the syllabus and marking schemes
 */
public interface ExamCatalogService {

    List<String> listExams();

    List<String> listSubjects(String exam);

    List<String> listChapters(String exam, String subject);

    /**
     * Marking scheme of a known exam.
     * Unlike scoring, the catalog does not fall back for unknown exams.
     */
    MarkingScheme getMarkingScheme(String exam);
}
