package uk.gegc.mockexam.features.ai.application;

import uk.gegc.mockexam.shared.exception.LlmServiceException;
import uk.gegc.mockexam.shared.exception.LlmTimeoutException;
import uk.gegc.mockexam.shared.exception.RateLimitExceededException;

/**
 * Sends a prompt to the language model and returns its raw text output.
 * Implementations own the retry and timeout policy.
 */
public interface LlmClient {

    /**
     * @param prompt the complete prompt
     * @return the model output, never null
     * @throws RateLimitExceededException when the provider keeps rejecting calls
     * @throws LlmTimeoutException        when calls keep timing out
     * @throws LlmServiceException        for any other provider failure
     */
    String call(String prompt);
}
