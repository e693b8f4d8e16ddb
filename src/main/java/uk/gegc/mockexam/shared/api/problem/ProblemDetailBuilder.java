package uk.gegc.mockexam.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Helper functions for building RFC 7807 {@link ProblemDetail} instances in a consistent way.
 *
 * <p>Every problem also carries the failure envelope of the API: {@code success=false},
 * {@code error} (the detail message) and, when known, {@code kind}.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Creates a {@link ProblemDetail} using the provided HTTP request to populate the {@code instance} field.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            String kind,
            HttpServletRequest request
    ) {
        ProblemDetail problem = base(status, type, title, detail, kind);
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        return problem;
    }

    /**
     * Creates a {@link ProblemDetail} using Spring's {@link WebRequest} to populate the instance field.
     * Useful inside Spring MVC override methods where an {@link HttpServletRequest} is not available.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            String kind,
            WebRequest request
    ) {
        ProblemDetail problem = base(status, type, title, detail, kind);
        if (request != null) {
            String description = request.getDescription(false);
            if (description != null) {
                String uri = description.startsWith("uri=") ? description.substring(4) : description;
                problem.setInstance(URI.create(uri));
            }
        }
        return problem;
    }

    /**
     * Creates a {@link ProblemDetail} and adds a {@code details} object when {@code details} is not empty.
     */
    public static ProblemDetail createWithDetails(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            String kind,
            HttpServletRequest request,
            Map<String, Object> details
    ) {
        ProblemDetail problem = create(status, type, title, detail, kind, request);
        if (details != null && !details.isEmpty()) {
            problem.setProperty("details", details);
        }
        return problem;
    }

    private static ProblemDetail base(HttpStatus status, URI type, String title, String detail, String kind) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        problem.setProperty("success", false);
        problem.setProperty("error", detail);
        if (kind != null) {
            problem.setProperty("kind", kind);
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
