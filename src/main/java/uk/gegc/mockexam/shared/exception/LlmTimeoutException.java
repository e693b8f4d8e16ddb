package uk.gegc.mockexam.shared.exception;

import java.util.Map;

/**
 * Exception thrown when a request to the LLM service times out
 */
public class LlmTimeoutException extends LlmServiceException {

    public LlmTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, Map.of(), cause);
    }
}
