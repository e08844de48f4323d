package ch.so.arp.assistant.chat;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import ch.so.arp.assistant.knowledge.KnowledgeProperties;
import ch.so.arp.assistant.knowledge.KnowledgeRetriever;
import ch.so.arp.assistant.knowledge.KnowledgeStore;

/**
 * Answers community questions: retrieves context from the knowledge base,
 * reads the conversation history, delegates to the {@link ModelClient} and
 * records the outcome in memory and in the usage log.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final ModelClient modelClient;
    private final KnowledgeRetriever knowledgeRetriever;
    private final KnowledgeStore knowledgeStore;
    private final ConversationMemory conversationMemory;
    private final AssistantSettingsRepository settingsRepository;
    private final UsageLog usageLog;
    private final Executor chatExecutor;
    private final ChatProperties chatProperties;
    private final int topK;
    private final Clock clock;

    public ChatService(ModelClient modelClient, KnowledgeRetriever knowledgeRetriever, KnowledgeStore knowledgeStore,
            ConversationMemory conversationMemory, AssistantSettingsRepository settingsRepository, UsageLog usageLog,
            @Qualifier("chatExecutor") Executor chatExecutor, ChatProperties chatProperties,
            KnowledgeProperties knowledgeProperties, Clock clock) {
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.knowledgeRetriever = Objects.requireNonNull(knowledgeRetriever, "knowledgeRetriever");
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
        this.conversationMemory = Objects.requireNonNull(conversationMemory, "conversationMemory");
        this.settingsRepository = Objects.requireNonNull(settingsRepository, "settingsRepository");
        this.usageLog = Objects.requireNonNull(usageLog, "usageLog");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
        this.chatProperties = Objects.requireNonNull(chatProperties, "chatProperties");
        this.topK = knowledgeProperties.getTopK();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Answer on the chat executor. The question is cancelled once the configured
     * answer timeout elapsed or when the returned future is cancelled.
     */
    public CompletableFuture<Optional<ModelAnswer>> answerAsync(String community, long userId, String question) {
        CancellationToken token = CancellationToken.withTimeout(chatProperties.getAnswerTimeout(), clock);
        CompletableFuture<Optional<ModelAnswer>> future = CompletableFuture
                .supplyAsync(() -> answer(community, userId, question, token), chatExecutor);
        future.whenComplete((answer, ex) -> {
            if (ex instanceof CancellationException) {
                token.cancel();
            }
        });
        return future;
    }

    /**
     * @return the answer, or empty if the assistant is disabled for the
     *         community or the community has no knowledge yet
     */
    public Optional<ModelAnswer> answer(String community, long userId, String question, CancellationToken token) {
        AssistantSettings settings = settingsRepository.find(community);
        if (!settings.enabled()) {
            LOGGER.debug("Assistant disabled for community {}", community);
            return Optional.empty();
        }
        if (!knowledgeStore.hasKnowledge(community)) {
            LOGGER.debug("Community {} has no knowledge, not answering", community);
            return Optional.empty();
        }

        String context = knowledgeRetriever.retrieve(community, question, topK);
        List<ChatMessage> history = conversationMemory.getHistory(community, userId);
        ModelAnswer answer = modelClient.answer(
                new AnswerRequest(community, userId, question, history, context, settings), token);

        if (answer.outcome() != AnswerOutcome.CANCELLED) {
            conversationMemory.appendTurn(community, userId, ChatRole.USER, question);
            conversationMemory.appendTurn(community, userId, ChatRole.ASSISTANT, answer.content());
        }
        recordUsage(UsageRecord.of(community, userId, question, answer, clock.instant()));
        LOGGER.info("Answered question of user {} in community {} with outcome {} after {} ms", userId, community,
                answer.outcome(), answer.latencyMs());
        return Optional.of(answer);
    }

    public UsageSummary usage(String community) {
        return usageLog.summarize(community);
    }

    private void recordUsage(UsageRecord usageRecord) {
        try {
            usageLog.record(usageRecord);
        } catch (DataAccessException ex) {
            LOGGER.error("Unable to record usage for community {}: {}", usageRecord.community(), ex.getMessage(), ex);
        }
    }
}
