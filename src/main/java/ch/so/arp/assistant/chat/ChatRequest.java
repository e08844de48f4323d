package ch.so.arp.assistant.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request payload for the chat endpoint.
 */
public record ChatRequest(@NotNull Long userId, @NotBlank String question) {
}
