package uk.gegc.mockexam.shared.api.problem;

import uk.gegc.mockexam.shared.exception.ErrorKind;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs, one per {@link ErrorKind} plus request-level errors.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://mockexam.gegc.uk/docs/errors";

    // ==================== Input Errors ====================
    public static final URI CONFIGURATION_INVALID = URI.create(BASE_URL + "/configuration-invalid");
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Generation Errors ====================
    public static final URI PARSING_FAILED = URI.create(BASE_URL + "/parsing-failed");
    public static final URI INSUFFICIENT_QUESTIONS = URI.create(BASE_URL + "/insufficient-questions");

    // ==================== LLM Errors ====================
    public static final URI LLM_SERVICE_UNAVAILABLE = URI.create(BASE_URL + "/llm-service-unavailable");
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");
    public static final URI LLM_TIMEOUT = URI.create(BASE_URL + "/llm-timeout");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI forKind(ErrorKind kind) {
        return switch (kind) {
            case CONFIGURATION -> CONFIGURATION_INVALID;
            case VALIDATION -> VALIDATION_FAILED;
            case PARSING -> PARSING_FAILED;
            case INSUFFICIENT_QUESTIONS -> INSUFFICIENT_QUESTIONS;
            case LLM_SERVICE -> LLM_SERVICE_UNAVAILABLE;
            case RATE_LIMIT -> RATE_LIMIT_EXCEEDED;
            case TIMEOUT -> LLM_TIMEOUT;
        };
    }
}
