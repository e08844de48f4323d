package ch.so.arp.assistant.chat;

/**
 * Abstraction over the language model endpoint. Implementations either call an
 * OpenAI compatible API or return predictable responses for testing.
 * Implementations perform exactly one request per call; retries, rate limiting
 * and timeouts are handled by {@link ModelClient}.
 */
public interface LlmClient {

    /**
     * Request a chat completion.
     *
     * @param request model, messages and sampling parameters
     * @return the generated answer
     * @throws LlmCallException if the endpoint fails or returns an unusable answer
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    LlmCompletion complete(LlmRequest request) throws LlmCallException, InterruptedException;
}
