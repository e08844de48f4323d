package ch.so.arp.assistant.chat;

/**
 * Result of a model call. Every outcome, including rate limiting and exhausted
 * retries, is returned as a value so that callers always have a message to show.
 */
public record ModelAnswer(AnswerOutcome outcome, String content, TokenUsage usage, long latencyMs) {

    public static final String RATE_LIMITED_MESSAGE = "Rate limit reached. Please try again in a moment.";
    public static final String UNAVAILABLE_MESSAGE = "Sorry, I'm unable to respond right now. Please try again later.";

    static ModelAnswer completed(String content, TokenUsage usage, long latencyMs) {
        return new ModelAnswer(AnswerOutcome.COMPLETED, content, usage, latencyMs);
    }

    static ModelAnswer rateLimited() {
        return new ModelAnswer(AnswerOutcome.RATE_LIMITED, RATE_LIMITED_MESSAGE, TokenUsage.NONE, 0L);
    }

    static ModelAnswer failed(long latencyMs) {
        return new ModelAnswer(AnswerOutcome.FAILED, UNAVAILABLE_MESSAGE, TokenUsage.NONE, latencyMs);
    }

    static ModelAnswer cancelled(long latencyMs) {
        return new ModelAnswer(AnswerOutcome.CANCELLED, UNAVAILABLE_MESSAGE, TokenUsage.NONE, latencyMs);
    }

    public boolean isCompleted() {
        return outcome == AnswerOutcome.COMPLETED;
    }
}
