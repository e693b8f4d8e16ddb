package uk.gegc.mockexam.shared.api.advice;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import uk.gegc.mockexam.shared.api.problem.ErrorTypes;
import uk.gegc.mockexam.shared.exception.ErrorKind;
import uk.gegc.mockexam.shared.exception.ParsingException;
import uk.gegc.mockexam.shared.exception.RateLimitExceededException;
import uk.gegc.mockexam.shared.exception.SubjectGenerationException;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("every error kind has an HTTP status")
    void statusPerKind() {
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.CONFIGURATION)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.VALIDATION)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.PARSING)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.INSUFFICIENT_QUESTIONS)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.LLM_SERVICE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.RATE_LIMIT)).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(GlobalExceptionHandler.statusFor(ErrorKind.TIMEOUT)).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    @DisplayName("problem carries type, instance and the failure envelope")
    void problemShape() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/exams/generate");

        ResponseEntity<ProblemDetail> response = handler.handleExamGeneration(
                new ParsingException("Empty LLM output", "", "Physics"), request);

        ProblemDetail problem = response.getBody();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(problem).isNotNull();
        assertThat(problem.getType()).isEqualTo(ErrorTypes.PARSING_FAILED);
        assertThat(problem.getInstance()).isEqualTo(URI.create("/api/exams/generate"));
        assertThat(problem.getProperties())
                .containsEntry("success", false)
                .containsEntry("error", "Empty LLM output")
                .containsEntry("kind", "PARSING")
                .containsKey("timestamp");
    }

    @Test
    @DisplayName("a wrapped rate limit keeps its status and Retry-After")
    void wrappedRateLimit() {
        SubjectGenerationException wrapped = new SubjectGenerationException("Physics",
                "Failed to generate questions for Physics: Rate limit exceeded",
                new RateLimitExceededException("Rate limit exceeded", 7, null));

        ResponseEntity<ProblemDetail> response = handler.handleExamGeneration(
                wrapped, new MockHttpServletRequest("POST", "/api/exams/generate"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("7");
    }

    @Test
    @DisplayName("unexpected exceptions become a generic 500")
    void unexpected() {
        ResponseEntity<ProblemDetail> response = handler.handleAllOthers(
                new IllegalStateException("secret internals"), new MockHttpServletRequest("GET", "/api/exams"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(response.getBody().getProperties()).containsEntry("kind", "INTERNAL");
    }
}
