package uk.gegc.mockexam.features.exam.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only exam to subject to chapters table, loaded once from the classpath.
 */
@Component
@Slf4j
public class SyllabusRegistry {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, List<String>>>> SYLLABUS_TYPE =
            new TypeReference<>() {
            };

    private final Map<String, Map<String, List<String>>> syllabus;

    public SyllabusRegistry(ResourceLoader resourceLoader,
                            ObjectMapper objectMapper,
                            @Value("${exam.syllabus-location:classpath:exam/syllabus.json}") String location) {
        this.syllabus = load(resourceLoader.getResource(location), objectMapper);
        log.info("Syllabus loaded from {}: exams {}", location, syllabus.keySet());
    }

    public List<String> exams() {
        return new ArrayList<>(syllabus.keySet());
    }

    public List<String> subjects(String exam) {
        return new ArrayList<>(syllabus.getOrDefault(exam, Map.of()).keySet());
    }

    public List<String> chapters(String exam, String subject) {
        return syllabus.getOrDefault(exam, Map.of()).getOrDefault(subject, List.of());
    }

    public boolean isValidExam(String exam) {
        return exam != null && syllabus.containsKey(exam);
    }

    public boolean isValidSubject(String exam, String subject) {
        return isValidExam(exam) && syllabus.get(exam).containsKey(subject);
    }

    public boolean isValidChapter(String exam, String subject, String chapter) {
        return chapters(exam, subject).contains(chapter);
    }

    private static Map<String, Map<String, List<String>>> load(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            throw new IllegalStateException("Syllabus resource not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, LinkedHashMap<String, List<String>>> raw = objectMapper.readValue(in, SYLLABUS_TYPE);
            Map<String, Map<String, List<String>>> table = new LinkedHashMap<>();
            raw.forEach((exam, subjects) -> {
                Map<String, List<String>> copy = new LinkedHashMap<>();
                subjects.forEach((subject, chapters) -> copy.put(subject, List.copyOf(chapters)));
                table.put(exam, Collections.unmodifiableMap(copy));
            });
            return Collections.unmodifiableMap(table);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load syllabus from " + resource.getDescription(), e);
        }
    }
}
