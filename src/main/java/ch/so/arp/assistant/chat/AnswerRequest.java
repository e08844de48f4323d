package ch.so.arp.assistant.chat;

import java.util.List;

/**
 * Everything the model client needs to answer a question.
 *
 * @param knowledgeContext retrieved context, empty if none is available
 */
public record AnswerRequest(
        String community,
        long userId,
        String question,
        List<ChatMessage> history,
        String knowledgeContext,
        AssistantSettings settings) {

    public AnswerRequest {
        history = List.copyOf(history);
        knowledgeContext = knowledgeContext == null ? "" : knowledgeContext;
    }
}
