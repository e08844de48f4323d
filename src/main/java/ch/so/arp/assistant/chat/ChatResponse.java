package ch.so.arp.assistant.chat;

/**
 * Response payload of the chat endpoint.
 */
public record ChatResponse(
        AnswerOutcome outcome,
        String content,
        int promptTokens,
        int completionTokens,
        int totalTokens,
        long latencyMs) {

    static ChatResponse from(ModelAnswer answer) {
        return new ChatResponse(answer.outcome(), answer.content(), answer.usage().promptTokens(),
                answer.usage().completionTokens(), answer.usage().totalTokens(), answer.latencyMs());
    }
}
