package uk.gegc.mockexam.features.generation.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.mockexam.features.exam.domain.model.SubjectConfig;
import uk.gegc.mockexam.features.generation.application.ExamGenerationService;
import uk.gegc.mockexam.features.generation.domain.model.GeneratedExam;
import uk.gegc.mockexam.features.generation.domain.model.GenerationMetadata;
import uk.gegc.mockexam.features.question.domain.model.QuestionRecord;
import uk.gegc.mockexam.shared.exception.ConfigurationException;
import uk.gegc.mockexam.shared.exception.InsufficientQuestionsException;
import uk.gegc.mockexam.shared.exception.LlmTimeoutException;
import uk.gegc.mockexam.shared.exception.RateLimitExceededException;
import uk.gegc.mockexam.testsupport.QuestionFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExamGenerationController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ExamGenerationController")
class ExamGenerationControllerTest {

    private static final String REQUEST = """
            {
              "exam": "JEE",
              "subject_data": {
                "Physics": {"chapters": ["Kinematics"], "num_questions": 2, "difficulty": "Hard"},
                "Chemistry": {"chapters": [], "num_questions": 1}
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExamGenerationService examGenerationService;

    @Test
    @DisplayName("POST /api/exams/generate returns questions, grouping and metadata")
    void generate_success() throws Exception {
        List<QuestionRecord> physics = List.of(
                QuestionFixtures.mcq(0, "Physics", "B"),
                QuestionFixtures.mcq(1, "Physics", "C"));
        GeneratedExam exam = new GeneratedExam(
                physics,
                Map.of("Physics", physics, "Chemistry", List.of()),
                Map.of("Chemistry", "Failed to generate questions for Chemistry: upstream down"),
                new GenerationMetadata("JEE", 2, List.of("Physics", "Chemistry"),
                        Map.of("Physics", 2, "Chemistry", 1), Map.of("Physics", 2, "Chemistry", 0), 1234));
        when(examGenerationService.generate(eq("JEE"), anyList())).thenReturn(exam);

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.questions.length()").value(2))
                .andExpect(jsonPath("$.questions[0].type").value("mcq"))
                .andExpect(jsonPath("$.questions[1].correct").value("C"))
                .andExpect(jsonPath("$.by_subject.Chemistry").isEmpty())
                .andExpect(jsonPath("$.failures.Chemistry").value("Failed to generate questions for Chemistry: upstream down"))
                .andExpect(jsonPath("$.metadata.total_questions").value(2))
                .andExpect(jsonPath("$.metadata.elapsed_ms").value(1234));
    }

    @Test
    @DisplayName("subject order, chapters and the default difficulty are passed to the service")
    @SuppressWarnings("unchecked")
    void generate_mapsRequest() throws Exception {
        when(examGenerationService.generate(eq("JEE"), anyList())).thenReturn(new GeneratedExam(
                List.of(QuestionFixtures.mcq(0, "Physics", "A")), Map.of(), Map.of(),
                new GenerationMetadata("JEE", 1, List.of(), Map.of(), Map.of(), 1)));

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isOk());

        ArgumentCaptor<List<SubjectConfig>> captor = ArgumentCaptor.forClass(List.class);
        verify(examGenerationService).generate(eq("JEE"), captor.capture());
        assertThat(captor.getValue()).containsExactly(
                new SubjectConfig("Physics", List.of("Kinematics"), 2, "Hard"),
                new SubjectConfig("Chemistry", List.of(), 1, "Medium"));
    }

    @Test
    @DisplayName("configuration errors map to 400 with the failure envelope")
    void generate_configurationError() throws Exception {
        when(examGenerationService.generate(eq("JEE"), anyList()))
                .thenThrow(new ConfigurationException("Invalid chapter 'Optics 2' for JEE Physics", "chapters", "Optics 2"));

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.kind").value("CONFIGURATION"))
                .andExpect(jsonPath("$.error").value("Invalid chapter 'Optics 2' for JEE Physics"))
                .andExpect(jsonPath("$.details.field").value("chapters"));
    }

    @Test
    @DisplayName("no generated questions maps to 422")
    void generate_insufficient() throws Exception {
        when(examGenerationService.generate(eq("JEE"), anyList()))
                .thenThrow(new InsufficientQuestionsException(3, 0));

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INSUFFICIENT_QUESTIONS"))
                .andExpect(jsonPath("$.details.requested").value(3))
                .andExpect(jsonPath("$.details.generated").value(0));
    }

    @Test
    @DisplayName("rate limiting maps to 429 with Retry-After")
    void generate_rateLimited() throws Exception {
        when(examGenerationService.generate(eq("JEE"), anyList()))
                .thenThrow(new RateLimitExceededException("Rate limit exceeded after 10 attempts", 12, null));

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "12"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(12))
                .andExpect(jsonPath("$.kind").value("RATE_LIMIT"));
    }

    @Test
    @DisplayName("LLM timeouts map to 504")
    void generate_timeout() throws Exception {
        when(examGenerationService.generate(eq("JEE"), anyList()))
                .thenThrow(new LlmTimeoutException("LLM request timed out after 10 attempts", null));

        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }

    @Test
    @DisplayName("missing num_questions fails bean validation")
    void generate_missingCount() throws Exception {
        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"exam": "JEE", "subject_data": {"Physics": {"chapters": ["Kinematics"]}}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.fieldErrors[0].message").value("num_questions is required"));

        verifyNoInteractions(examGenerationService);
    }

    @Test
    @DisplayName("a null subject entry fails bean validation")
    void generate_nullSubjectSettings() throws Exception {
        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"exam": "JEE", "subject_data": {"Physics": null}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.fieldErrors[0].message").value("subject settings are required"));

        verifyNoInteractions(examGenerationService);
    }

    @Test
    @DisplayName("a null chapter name fails bean validation")
    void generate_nullChapter() throws Exception {
        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"exam": "JEE", "subject_data": {"Physics": {"chapters": [null], "num_questions": 2}}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.fieldErrors[0].message").value("chapter names must not be blank"));

        verifyNoInteractions(examGenerationService);
    }

    @Test
    @DisplayName("malformed JSON is rejected with 400")
    void generate_malformedJson() throws Exception {
        mockMvc.perform(post("/api/exams/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"exam\": \"JEE\", "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }
}
