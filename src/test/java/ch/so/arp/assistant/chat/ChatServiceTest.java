package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import ch.so.arp.assistant.MutableClock;
import ch.so.arp.assistant.knowledge.KnowledgeChunk;
import ch.so.arp.assistant.knowledge.KnowledgeProperties;
import ch.so.arp.assistant.knowledge.KnowledgeRetriever;
import ch.so.arp.assistant.knowledge.KnowledgeStore;

class ChatServiceTest {

    private static final AssistantSettings ENABLED = new AssistantSettings("dev", true, "Be brief.", 0.7d, 256);

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
    private final ExecutorService modelCallExecutor = Executors.newCachedThreadPool();
    private final KnowledgeStore knowledgeStore = mock(KnowledgeStore.class);
    private final AssistantSettingsRepository settingsRepository = mock(AssistantSettingsRepository.class);
    private final ConversationMemory memory = new ConversationMemory(Duration.ofMinutes(30), 5, clock);
    private final RecordingUsageLog usageLog = new RecordingUsageLog();
    private final AtomicReference<LlmRequest> lastRequest = new AtomicReference<>();
    private final AtomicInteger llmCalls = new AtomicInteger();

    private volatile boolean llmFails;

    @BeforeEach
    void setUp() {
        when(settingsRepository.find("dev")).thenReturn(ENABLED);
        when(knowledgeStore.hasKnowledge("dev")).thenReturn(true);
        when(knowledgeStore.listChunks("dev")).thenReturn(List.of(
                new KnowledgeChunk(1L, 1L, "crypto.md", "dev", 0, "Bitcoin is a decentralized digital currency.",
                        List.of("bitcoin"), 44),
                new KnowledgeChunk(2L, 1L, "crypto.md", "dev", 1, "Weather today is sunny.", List.of("weather"), 23)));
    }

    @AfterEach
    void tearDown() {
        modelCallExecutor.shutdownNow();
    }

    @Test
    void answersWithKnowledgeAndRemembersTurns() {
        ChatService chatService = chatService();

        Optional<ModelAnswer> answer = chatService.answer("dev", 1L, "What is Bitcoin?", CancellationToken.create());

        assertThat(answer).get().extracting(ModelAnswer::outcome).isEqualTo(AnswerOutcome.COMPLETED);
        assertThat(lastRequest.get().messages().get(0).content())
                .contains("[Source: crypto.md]\nBitcoin is a decentralized digital currency.");
        assertThat(memory.getHistory("dev", 1L)).containsExactly(
                ChatMessage.user("What is Bitcoin?"), ChatMessage.assistant("answer 1"));
        assertThat(usageLog.records).singleElement().satisfies(usage -> {
            assertThat(usage.outcome()).isEqualTo(AnswerOutcome.COMPLETED);
            assertThat(usage.usage().totalTokens()).isEqualTo(30);
            assertThat(usage.question()).isEqualTo("What is Bitcoin?");
        });
    }

    @Test
    void passesHistoryOfPreviousQuestions() {
        ChatService chatService = chatService();
        chatService.answer("dev", 1L, "What is Bitcoin?", CancellationToken.create());

        chatService.answer("dev", 1L, "And who made it?", CancellationToken.create());

        assertThat(lastRequest.get().messages()).extracting(ChatMessage::role)
                .containsExactly(ChatRole.SYSTEM, ChatRole.USER, ChatRole.ASSISTANT, ChatRole.USER);
    }

    @Test
    void staysSilentWhenAssistantDisabled() {
        when(settingsRepository.find("ops")).thenReturn(new AssistantSettings("ops", false, "x", 0.7d, 256));

        assertThat(chatService().answer("ops", 1L, "Hello?", CancellationToken.create())).isEmpty();
        assertThat(llmCalls).hasValue(0);
        assertThat(usageLog.records).isEmpty();
    }

    @Test
    void staysSilentWithoutKnowledge() {
        when(settingsRepository.find("empty")).thenReturn(new AssistantSettings("empty", true, "x", 0.7d, 256));
        when(knowledgeStore.hasKnowledge("empty")).thenReturn(false);

        assertThat(chatService().answer("empty", 1L, "Hello?", CancellationToken.create())).isEmpty();
        assertThat(llmCalls).hasValue(0);
    }

    @Test
    void remembersAndLogsFailedAnswer() {
        llmFails = true;

        Optional<ModelAnswer> answer = chatService().answer("dev", 1L, "Hello?", CancellationToken.create());

        assertThat(answer).get().extracting(ModelAnswer::content).isEqualTo(ModelAnswer.UNAVAILABLE_MESSAGE);
        assertThat(memory.getHistory("dev", 1L)).containsExactly(
                ChatMessage.user("Hello?"), ChatMessage.assistant(ModelAnswer.UNAVAILABLE_MESSAGE));
        assertThat(usageLog.records).singleElement().satisfies(usage -> {
            assertThat(usage.outcome()).isEqualTo(AnswerOutcome.FAILED);
            assertThat(usage.usage().totalTokens()).isZero();
        });
    }

    @Test
    void doesNotRememberCancelledQuestion() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        Optional<ModelAnswer> answer = chatService().answer("dev", 1L, "Hello?", token);

        assertThat(answer).get().extracting(ModelAnswer::outcome).isEqualTo(AnswerOutcome.CANCELLED);
        assertThat(memory.getHistory("dev", 1L)).isEmpty();
        assertThat(usageLog.records).singleElement().extracting(UsageRecord::outcome)
                .isEqualTo(AnswerOutcome.CANCELLED);
    }

    @Test
    void keepsAnsweringWhenUsageLogFails() {
        usageLog.failing = true;

        Optional<ModelAnswer> answer = chatService().answer("dev", 1L, "Hello?", CancellationToken.create());

        assertThat(answer).get().extracting(ModelAnswer::isCompleted).isEqualTo(true);
    }

    @Test
    void answersAsynchronouslyOnChatExecutor() throws Exception {
        Optional<ModelAnswer> answer = chatService().answerAsync("dev", 1L, "What is Bitcoin?").get();

        assertThat(answer).get().extracting(ModelAnswer::content).isEqualTo("answer 1");
    }

    private ChatService chatService() {
        LlmClient llmClient = request -> {
            lastRequest.set(request);
            int call = llmCalls.incrementAndGet();
            if (llmFails) {
                throw new LlmCallException("connection reset");
            }
            return new LlmCompletion("answer " + call, new TokenUsage(20, 10, 30));
        };
        ModelClient modelClient = new ModelClient(llmClient,
                new SlidingWindowRateLimiter(10, Duration.ofSeconds(60), clock), new ConcurrencyGate(5),
                new PromptAssembler(6000, 10), BackoffStrategy.none(), modelCallExecutor, "test-model", 3,
                Duration.ofSeconds(5));
        return new ChatService(modelClient, new KnowledgeRetriever(knowledgeStore), knowledgeStore, memory,
                settingsRepository, usageLog, Runnable::run, new ChatProperties(), new KnowledgeProperties(), clock);
    }

    private static final class RecordingUsageLog implements UsageLog {

        private final List<UsageRecord> records = new CopyOnWriteArrayList<>();
        private volatile boolean failing;

        @Override
        public void record(UsageRecord usageRecord) {
            if (failing) {
                throw new DataAccessResourceFailureException("database down");
            }
            records.add(usageRecord);
        }

        @Override
        public UsageSummary summarize(String community) {
            long tokens = records.stream().mapToLong(usage -> usage.usage().totalTokens()).sum();
            return new UsageSummary(community, records.size(), tokens);
        }
    }
}
