package ch.so.arp.assistant.chat;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an OpenAI compatible chat completion request.
 */
public record LlmRequest(
        String model,
        List<ChatMessage> messages,
        double temperature,
        @JsonProperty("max_tokens") int maxTokens) {

    public LlmRequest {
        messages = List.copyOf(messages);
    }
}
