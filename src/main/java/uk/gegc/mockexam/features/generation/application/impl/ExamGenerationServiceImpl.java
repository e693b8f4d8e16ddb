package uk.gegc.mockexam.features.generation.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.exam.application.ExamConfigValidator;
import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;
import uk.gegc.mockexam.features.exam.infra.SyllabusRegistry;
import uk.gegc.mockexam.features.generation.application.ExamGenerationService;
import uk.gegc.mockexam.features.generation.application.SubjectQuestionGenerator;
import uk.gegc.mockexam.features.generation.domain.model.GeneratedExam;
import uk.gegc.mockexam.features.generation.domain.model.GenerationMetadata;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.config.GenerationProperties;
import uk.gegc.mockexam.shared.exception.ConfigurationException;
import uk.gegc.mockexam.shared.exception.InsufficientQuestionsException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ExamGenerationServiceImpl implements ExamGenerationService {

    private final SubjectQuestionGenerator subjectGenerator;
    private final ExamConfigValidator configValidator;
    private final SyllabusRegistry syllabus;
    private final GenerationProperties generationProperties;
    private final Executor generationExecutor;

    public ExamGenerationServiceImpl(SubjectQuestionGenerator subjectGenerator,
                                     ExamConfigValidator configValidator,
                                     SyllabusRegistry syllabus,
                                     GenerationProperties generationProperties,
                                     @Qualifier("generationTaskExecutor") Executor generationExecutor) {
        this.subjectGenerator = subjectGenerator;
        this.configValidator = configValidator;
        this.syllabus = syllabus;
        this.generationProperties = generationProperties;
        this.generationExecutor = generationExecutor;
    }

    @Override
    public GeneratedExam generate(String exam, List<SubjectConfig> subjects) {
        Instant start = Instant.now();
        log.info("Starting question generation for {} - subjects: {}", exam,
                subjects.stream().map(SubjectConfig::subject).collect(Collectors.joining(", ")));

        configValidator.validateExam(exam);
        List<SubjectConfig> configs = resolveChapters(exam, subjects);
        validateAll(exam, configs);

        List<SubjectOutcome> outcomes = generationProperties.isParallel()
                ? runParallel(exam, configs)
                : runSequential(exam, configs);

        // merge on the calling thread, in subject order
        List<QuestionRecord> allQuestions = new ArrayList<>();
        Map<String, List<QuestionRecord>> bySubject = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        Map<String, Integer> requested = new LinkedHashMap<>();
        Map<String, Integer> generated = new LinkedHashMap<>();
        int nextId = 0;

        for (SubjectOutcome outcome : outcomes) {
            String subject = outcome.config().subject();
            List<QuestionRecord> numbered = new ArrayList<>();
            for (QuestionRecord question : outcome.questions()) {
                numbered.add(question.withId(nextId++));
            }
            allQuestions.addAll(numbered);
            bySubject.put(subject, numbered);
            requested.put(subject, outcome.config().numQuestions());
            generated.put(subject, numbered.size());
            if (outcome.failure() != null) {
                failures.put(subject, outcome.failure());
            } else if (numbered.size() < outcome.config().numQuestions()) {
                log.warn("Insufficient questions for {}: requested {}, got {}",
                        subject, outcome.config().numQuestions(), numbered.size());
            }
        }

        long elapsed = Duration.between(start, Instant.now()).toMillis();
        log.info("Question generation complete: {} total questions in {}ms", allQuestions.size(), elapsed);

        if (allQuestions.isEmpty()) {
            int totalRequested = configs.stream().mapToInt(SubjectConfig::numQuestions).sum();
            throw new InsufficientQuestionsException(totalRequested, 0);
        }

        GenerationMetadata metadata = new GenerationMetadata(
                exam, allQuestions.size(), new ArrayList<>(bySubject.keySet()), requested, generated, elapsed);
        return new GeneratedExam(allQuestions, bySubject, failures, metadata);
    }

    @Override
    public List<QuestionRecord> generateSingleSubject(String exam, String subject, List<String> chapters,
                                                      int numQuestions, String difficulty) {
        return generate(exam, List.of(new SubjectConfig(subject, chapters, numQuestions, difficulty))).questions();
    }

    private List<SubjectConfig> resolveChapters(String exam, List<SubjectConfig> subjects) {
        List<SubjectConfig> resolved = new ArrayList<>(subjects.size());
        for (SubjectConfig config : subjects) {
            if (config.chapters().isEmpty()) {
                log.info("No chapters specified for {}, using full syllabus", config.subject());
                resolved.add(config.withChapters(syllabus.chapters(exam, config.subject())));
            } else {
                resolved.add(config);
            }
        }
        return resolved;
    }

    private void validateAll(String exam, List<SubjectConfig> configs) {
        if (configs.isEmpty()) {
            throw new ConfigurationException("At least one subject is required", "subject_data", null);
        }
        Set<String> seen = new HashSet<>();
        for (SubjectConfig config : configs) {
            if (!seen.add(config.subject())) {
                throw new ConfigurationException("Duplicate subject '" + config.subject() + "'",
                        "subject", config.subject());
            }
            try {
                configValidator.validateSubjectConfig(exam, config);
            } catch (ConfigurationException e) {
                log.error("Validation failed for {}: {}", config.subject(), e.getMessage());
                throw e;
            }
        }
    }

    private List<SubjectOutcome> runSequential(String exam, List<SubjectConfig> configs) {
        List<SubjectOutcome> outcomes = new ArrayList<>(configs.size());
        for (SubjectConfig config : configs) {
            outcomes.add(runSubject(exam, config));
        }
        return outcomes;
    }

    private List<SubjectOutcome> runParallel(String exam, List<SubjectConfig> configs) {
        log.info("Running {} subjects on the generation executor", configs.size());
        List<CompletableFuture<SubjectOutcome>> futures = configs.stream()
                .map(config -> CompletableFuture.supplyAsync(() -> runSubject(exam, config), generationExecutor))
                .toList();

        // join in submission order so completion order never affects the output
        List<SubjectOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                SubjectConfig config = configs.get(i);
                log.error("Generation task for {} failed", config.subject(), cause);
                outcomes.add(SubjectOutcome.failed(config, cause.getMessage()));
            }
        }
        return outcomes;
    }

    private SubjectOutcome runSubject(String exam, SubjectConfig config) {
        log.info("Generating {} questions for {}", config.numQuestions(), config.subject());
        try {
            List<QuestionRecord> questions = subjectGenerator.generateForSubject(
                    exam, config.subject(), config.chapters(), config.numQuestions(), config.difficulty());
            return new SubjectOutcome(config, questions, null);
        } catch (RuntimeException e) {
            log.error("Failed to generate questions for {}: {}", config.subject(), e.getMessage());
            log.warn("Skipping {} due to error", config.subject());
            return SubjectOutcome.failed(config, e.getMessage());
        }
    }

    private record SubjectOutcome(SubjectConfig config, List<QuestionRecord> questions, String failure) {

        static SubjectOutcome failed(SubjectConfig config, String message) {
            return new SubjectOutcome(config, List.of(), message == null ? "Generation failed" : message);
        }
    }
}
