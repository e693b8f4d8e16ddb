package uk.gegc.mockexam.features.generation.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.ai.application.LlmClient;
import uk.gegc.mockexam.features.ai.application.PromptTemplateService;
import uk.gegc.mockexam.features.generation.application.SubjectQuestionGenerator;
import uk.gegc.mockexam.features.question.domain.model.ParseReport;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.features.question.infra.parser.QuestionResponseParser;
import uk.gegc.mockexam.shared.config.GenerationProperties;
import uk.gegc.mockexam.shared.exception.ExamGenerationException;
import uk.gegc.mockexam.shared.exception.SubjectGenerationException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectQuestionGeneratorImpl implements SubjectQuestionGenerator {

    private final LlmClient llmClient;
    private final PromptTemplateService promptTemplateService;
    private final QuestionResponseParser responseParser;
    private final GenerationProperties generationProperties;
    private final MeterRegistry meterRegistry;

    @Override
    public List<QuestionRecord> generateForSubject(String exam, String subject, List<String> chapters,
                                                   int numQuestions, String difficulty) {
        Instant start = Instant.now();
        int toRequest = numQuestions + generationProperties.getSafetyBuffer();
        log.info("Requesting {} questions for {} (target: {})", toRequest, subject, numQuestions);

        try {
            String prompt = promptTemplateService.buildQuestionPaperPrompt(
                    exam, subject, String.join(", ", chapters), toRequest, difficulty);

            String response = llmClient.call(prompt);

            ParseReport report = responseParser.parseWithReport(response, subject, toRequest, false);
            recordParseCounts(subject, report);

            List<QuestionRecord> questions = report.questions();
            if (questions.size() > numQuestions) {
                log.info("Generated {} valid questions for {}, keeping the first {}",
                        questions.size(), subject, numQuestions);
                questions = questions.subList(0, numQuestions);
            } else if (questions.size() < numQuestions) {
                log.warn("Only {} valid questions for {} (requested {})", questions.size(), subject, numQuestions);
            }

            String chapter = chapters.isEmpty() ? null : chapters.get(0);
            List<QuestionRecord> enriched = questions.stream()
                    .map(question -> question.withMetadata(difficulty, chapter))
                    .toList();

            recordDuration(subject, "success", start);
            log.info("Generated {} questions for {} in {}ms ({} strategy)",
                    enriched.size(), subject, Duration.between(start, Instant.now()).toMillis(), report.strategy());
            return enriched;

        } catch (ExamGenerationException e) {
            recordDuration(subject, "failure", start);
            log.error("Failed to generate questions for {}: {}", subject, e.getMessage());
            throw new SubjectGenerationException(subject,
                    "Failed to generate questions for " + subject + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            recordDuration(subject, "failure", start);
            log.error("Unexpected error generating questions for {}", subject, e);
            throw new SubjectGenerationException(subject,
                    "Failed to generate questions for " + subject + ": " + e.getMessage(), (Throwable) e);
        }
    }

    private void recordParseCounts(String subject, ParseReport report) {
        Counter.builder("exam.generation.questions.parsed")
                .description("Question candidates parsed from model output")
                .tag("subject", subject)
                .register(meterRegistry)
                .increment(report.parsed());
        Counter.builder("exam.generation.questions.invalid")
                .description("Parsed questions dropped by validation")
                .tag("subject", subject)
                .register(meterRegistry)
                .increment(report.invalid());
    }

    private void recordDuration(String subject, String outcome, Instant start) {
        Timer.builder("exam.generation.subject")
                .description("End-to-end generation time per subject")
                .tag("subject", subject)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(Duration.between(start, Instant.now()));
    }
}
