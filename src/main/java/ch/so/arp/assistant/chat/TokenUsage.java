package ch.so.arp.assistant.chat;

/**
 * Token accounting reported by the model endpoint.
 */
public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);
}
