package ch.so.arp.assistant.chat;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import ch.so.arp.assistant.ClockConfiguration;

/**
 * Central configuration wiring the chat components together. It exposes a
 * toggle that decides whether the mocked or the real model endpoint is used.
 */
@Configuration
@EnableConfigurationProperties(ChatProperties.class)
@Import(ClockConfiguration.class)
public class ChatConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "chatExecutor")
    public ExecutorService chatExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("chat-"));
    }

    @Bean
    @ConditionalOnMissingBean(name = "modelCallExecutor")
    public ExecutorService modelCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("model-call-"));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(ChatProperties properties, Environment environment,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        ChatProperties.Endpoint endpoint = properties.getOpenai();
        String apiKey = StringUtils.hasText(endpoint.getApiKey()) ? endpoint.getApiKey()
                : environment.getProperty("deepseek.api-key");
        return new OpenAiLlmClient(endpoint.getBaseUrl(), apiKey, restClientBuilder.getIfAvailable(RestClient::builder),
                properties.getCallTimeout());
    }

    @Bean
    public ConversationMemory conversationMemory(ChatProperties properties, Clock clock) {
        return new ConversationMemory(properties.getMemoryTtl(), properties.getMemoryMaxRounds(), clock);
    }

    @Bean
    public SlidingWindowRateLimiter rateLimiter(ChatProperties properties, Clock clock) {
        return new SlidingWindowRateLimiter(properties.getRateLimit(), properties.getRateWindow(), clock);
    }

    @Bean
    public ConcurrencyGate concurrencyGate(ChatProperties properties) {
        return new ConcurrencyGate(properties.getMaxConcurrentCalls());
    }

    @Bean
    public PromptAssembler promptAssembler(ChatProperties properties) {
        return new PromptAssembler(properties.getContextCharLimit(), properties.getHistoryMessageLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffStrategy backoffStrategy(ChatProperties properties) {
        return BackoffStrategy.fixed(properties.getRetryDelay());
    }

    @Bean
    public ModelClient modelClient(LlmClient llmClient, SlidingWindowRateLimiter rateLimiter, ConcurrencyGate gate,
            PromptAssembler promptAssembler, BackoffStrategy backoffStrategy,
            @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor, ChatProperties properties) {
        return new ModelClient(llmClient, rateLimiter, gate, promptAssembler, backoffStrategy, modelCallExecutor,
                properties.getOpenai().getModel(), properties.getMaxAttempts(), properties.getCallTimeout());
    }

    @Bean
    public AssistantSettingsRepository assistantSettingsRepository(NamedParameterJdbcOperations jdbcOperations,
            ChatProperties properties) {
        return new AssistantSettingsRepository(jdbcOperations, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public UsageLog usageLog(NamedParameterJdbcOperations jdbcOperations) {
        return new JdbcUsageLog(jdbcOperations);
    }

    @Bean
    public ChatStateSweeper chatStateSweeper(ConversationMemory conversationMemory,
            SlidingWindowRateLimiter rateLimiter) {
        return new ChatStateSweeper(conversationMemory, rateLimiter);
    }
}
