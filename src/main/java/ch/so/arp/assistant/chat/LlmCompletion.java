package ch.so.arp.assistant.chat;

/**
 * Generated answer together with its token usage.
 */
public record LlmCompletion(String content, TokenUsage usage) {
}
