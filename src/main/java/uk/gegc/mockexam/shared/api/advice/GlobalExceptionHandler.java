package uk.gegc.mockexam.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.mockexam.shared.api.problem.ErrorTypes;
import uk.gegc.mockexam.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.mockexam.shared.exception.ErrorKind;
import uk.gegc.mockexam.shared.exception.ExamGenerationException;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String INTERNAL_KIND = "INTERNAL";

    @ExceptionHandler(ExamGenerationException.class)
    public ResponseEntity<ProblemDetail> handleExamGeneration(ExamGenerationException ex, HttpServletRequest request) {
        ErrorKind kind = ex.kind();
        HttpStatus status = statusFor(kind);
        if (status.is5xxServerError()) {
            logger.error("Request failed with {}: {}", kind, ex.getMessage(), ex);
        } else {
            logger.warn("Request rejected with {}: {}", kind, ex);
        }

        ProblemDetail problem = ProblemDetailBuilder.createWithDetails(
                status,
                ErrorTypes.forKind(kind),
                titleFor(kind),
                ex.getMessage(),
                kind.name(),
                request,
                ex.details()
        );

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (kind == ErrorKind.RATE_LIMIT) {
            Object retryAfter = ex.details().get("retryAfter");
            if (retryAfter != null) {
                problem.setProperty("retryAfterSeconds", retryAfter);
                response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
            }
        }
        return response.body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                ErrorKind.VALIDATION.name(),
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                ErrorKind.VALIDATION.name(),
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                INTERNAL_KIND,
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case CONFIGURATION, VALIDATION -> HttpStatus.BAD_REQUEST;
            case PARSING, INSUFFICIENT_QUESTIONS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case LLM_SERVICE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String titleFor(ErrorKind kind) {
        return switch (kind) {
            case CONFIGURATION -> "Invalid Configuration";
            case VALIDATION -> "Validation Failed";
            case PARSING -> "Parsing Failed";
            case INSUFFICIENT_QUESTIONS -> "Insufficient Questions";
            case LLM_SERVICE -> "LLM Service Unavailable";
            case RATE_LIMIT -> "Rate Limit Exceeded";
            case TIMEOUT -> "LLM Timeout";
        };
    }

    public record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
