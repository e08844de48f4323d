package ch.so.arp.assistant.chat;

import java.util.List;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * model endpoint should not be contacted.
 */
class MockLlmClient implements LlmClient {

    @Override
    public LlmCompletion complete(LlmRequest request) {
        List<ChatMessage> messages = request.messages();
        ChatMessage question = messages.get(messages.size() - 1);
        boolean withKnowledge = messages.get(0).content().contains(PromptAssembler.KNOWLEDGE_INTRO);
        String content = "[mocked answer] Provide an API key to reach the real model. Question was: "
                + question.content() + (withKnowledge ? " (answered with knowledge base)" : "");
        int promptTokens = messages.stream().mapToInt(message -> wordCount(message.content())).sum();
        int completionTokens = wordCount(content);
        return new LlmCompletion(content, new TokenUsage(promptTokens, completionTokens,
                promptTokens + completionTokens));
    }

    private static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
