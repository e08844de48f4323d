package ch.so.arp.assistant.chat;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list sent to the model: the system prompt, optionally
 * followed by the retrieved knowledge, the most recent history and finally the
 * user question.
 */
public class PromptAssembler {

    static final String KNOWLEDGE_INTRO = "\n\nBelow is your knowledge base. Answer user questions based on this "
            + "content. If the answer is not in the knowledge base, say you're not sure but try to be helpful.\n---\n";
    static final String KNOWLEDGE_OUTRO = "\n---";

    private final int contextCharLimit;
    private final int historyMessageLimit;

    public PromptAssembler(int contextCharLimit, int historyMessageLimit) {
        if (contextCharLimit <= 0 || historyMessageLimit < 0) {
            throw new IllegalArgumentException("Limits must not be negative");
        }
        this.contextCharLimit = contextCharLimit;
        this.historyMessageLimit = historyMessageLimit;
    }

    public List<ChatMessage> assemble(AnswerRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemContent(request.settings().systemPrompt(), request.knowledgeContext())));
        List<ChatMessage> history = request.history();
        int from = Math.max(0, history.size() - historyMessageLimit);
        messages.addAll(history.subList(from, history.size()));
        messages.add(ChatMessage.user(request.question()));
        return messages;
    }

    private String systemContent(String systemPrompt, String knowledgeContext) {
        if (knowledgeContext.isBlank()) {
            return systemPrompt;
        }
        return systemPrompt + KNOWLEDGE_INTRO + truncate(knowledgeContext) + KNOWLEDGE_OUTRO;
    }

    String truncate(String context) {
        if (context.length() <= contextCharLimit) {
            return context;
        }
        int end = contextCharLimit;
        // keep surrogate pairs intact
        if (Character.isHighSurrogate(context.charAt(end - 1))) {
            end--;
        }
        return context.substring(0, end);
    }
}
