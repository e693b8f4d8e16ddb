package uk.gegc.mockexam.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.mockexam.features.ai.application.PromptTemplateService;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    private static final String BASE_TEMPLATE = "base/question-paper.txt";

    // subjects that share another subject's example
    private static final Map<String, String> EXAMPLE_ALIASES = Map.of(
            "botany", "biology",
            "zoology", "biology"
    );

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildQuestionPaperPrompt(String exam, String subject, String chaptersCsv,
                                           int numQuestions, String difficulty) {
        if (exam == null || exam.isBlank()) {
            throw new IllegalArgumentException("Exam cannot be null or empty");
        }
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or empty");
        }
        if (numQuestions < 1) {
            throw new IllegalArgumentException("Question count must be positive");
        }
        if (difficulty == null) {
            throw new IllegalArgumentException("Difficulty cannot be null");
        }
        String chapters = chaptersCsv == null ? "" : chaptersCsv;

        try {
            StringBuilder prompt = new StringBuilder(loadPromptTemplate(BASE_TEMPLATE));

            loadOptionalTemplate("difficulty/" + difficulty.toLowerCase(Locale.ROOT) + ".txt")
                    .ifPresent(modifier -> prompt.append("\n\n").append(modifier));
            loadOptionalTemplate("examples/" + exampleName(subject) + ".txt")
                    .ifPresent(example -> prompt.append("\n\n").append(example));

            return prompt.toString()
                    .replace("{exam}", exam)
                    .replace("{subject}", subject)
                    .replace("{chapters}", chapters)
                    .replace("{numQuestions}", String.valueOf(numQuestions))
                    .replace("{difficulty}", difficulty);

        } catch (UncheckedIOException e) {
            log.error("Error building prompt for {} {}", exam, subject, e);
            // Fallback to simple prompt
            return String.format("""
                    Generate %d %s difficulty multiple-choice questions for the %s exam.
                    Subject: %s
                    Chapters: %s

                    Use exactly this format for every question:
                    Q1. question text
                    A) option
                    B) option
                    C) option
                    D) option
                    Answer: letter
                    Solution: explanation
                    """, numQuestions, difficulty, exam, subject, chapters);
        }
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private Optional<String> loadOptionalTemplate(String templateName) {
        String cached = templateCache.get(templateName);
        if (cached != null) {
            return Optional.of(cached);
        }
        Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
        if (!resource.exists()) {
            log.debug("No prompt template {}", templateName);
            return Optional.empty();
        }
        return Optional.of(loadPromptTemplate(templateName));
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load template: " + templateName, e);
        }
    }

    private static String exampleName(String subject) {
        String key = subject.trim().toLowerCase(Locale.ROOT);
        return EXAMPLE_ALIASES.getOrDefault(key, key);
    }
}
