package uk.gegc.mockexam.features.exam.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.exam.application.ExamCatalogService;
import uk.gegc.mockexam.features.exam.application.ExamConfigValidator;
import uk.gegc.mockexam.features.exam.domain.model.MarkingScheme;
import uk.gegc.mockexam.features.exam.infra.SyllabusRegistry;
import uk.gegc.mockexam.shared.config.MarkingSchemeProperties;
import uk.gegc.mockexam.shared.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class ExamCatalogServiceImpl implements ExamCatalogService {

    private final SyllabusRegistry syllabus;
    private final ExamConfigValidator configValidator;
    private final MarkingSchemeProperties markingSchemes;

    @Override
    public List<String> listExams() {
        return syllabus.exams();
    }

    @Override
    public List<String> listSubjects(String exam) {
        configValidator.validateExam(exam);
        return syllabus.subjects(exam);
    }

    @Override
    public List<String> listChapters(String exam, String subject) {
        configValidator.validateExam(exam);
        configValidator.validateSubject(exam, subject);
        return syllabus.chapters(exam, subject);
    }

    @Override
    public MarkingScheme getMarkingScheme(String exam) {
        if (!markingSchemes.isConfigured(exam)) {
            throw new ConfigurationException("No marking scheme configured for exam " + exam,
                    "exam", exam, new ArrayList<>(markingSchemes.getSchemes().keySet()));
        }
        return markingSchemes.resolve(exam);
    }
}
