package ch.so.arp.assistant.chat;

/**
 * Per-community model configuration.
 */
public record AssistantSettings(
        String community,
        boolean enabled,
        String systemPrompt,
        double temperature,
        int maxTokens) {
}
