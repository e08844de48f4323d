package ch.so.arp.assistant.chat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the chat engine.
 */
@ConfigurationProperties(prefix = "rag.chat")
public class ChatProperties {

    /**
     * Use the deterministic mock instead of the real model endpoint.
     */
    private boolean mockOpenai = true;

    /**
     * Interval of the sweep that drops expired conversations and idle rate
     * windows.
     */
    private Duration sweepInterval = Duration.ofMinutes(1);

    /**
     * How long conversation turns are remembered.
     */
    private Duration memoryTtl = Duration.ofMinutes(30);

    /**
     * Number of question/answer pairs kept per conversation.
     */
    private int memoryMaxRounds = 5;

    /**
     * Model calls admitted per community within {@link #rateWindow}.
     */
    private int rateLimit = 10;

    private Duration rateWindow = Duration.ofSeconds(60);

    /**
     * Global cap on in-flight model calls.
     */
    private int maxConcurrentCalls = 5;

    /**
     * Attempts per model call, including the first one.
     */
    private int maxAttempts = 3;

    /**
     * Pause between two attempts.
     */
    private Duration retryDelay = Duration.ofSeconds(1);

    /**
     * Upper bound of a single attempt.
     */
    private Duration callTimeout = Duration.ofSeconds(30);

    /**
     * Deadline for a whole question including retries.
     */
    private Duration answerTimeout = Duration.ofSeconds(120);

    /**
     * Maximum number of knowledge characters placed in the prompt.
     */
    private int contextCharLimit = 6000;

    private int historyMessageLimit = 10;

    /**
     * System prompt of communities without their own settings.
     */
    private String systemPrompt = "You are a friendly community assistant. Answer user questions based on the knowledge base.";

    private double temperature = 0.7;

    private int maxTokens = 1024;

    private final Endpoint openai = new Endpoint();

    public boolean isMockOpenai() {
        return mockOpenai;
    }

    public void setMockOpenai(boolean mockOpenai) {
        this.mockOpenai = mockOpenai;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getMemoryTtl() {
        return memoryTtl;
    }

    public void setMemoryTtl(Duration memoryTtl) {
        this.memoryTtl = memoryTtl;
    }

    public int getMemoryMaxRounds() {
        return memoryMaxRounds;
    }

    public void setMemoryMaxRounds(int memoryMaxRounds) {
        this.memoryMaxRounds = memoryMaxRounds;
    }

    public int getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(int rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public void setRateWindow(Duration rateWindow) {
        this.rateWindow = rateWindow;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Duration getAnswerTimeout() {
        return answerTimeout;
    }

    public void setAnswerTimeout(Duration answerTimeout) {
        this.answerTimeout = answerTimeout;
    }

    public int getContextCharLimit() {
        return contextCharLimit;
    }

    public void setContextCharLimit(int contextCharLimit) {
        this.contextCharLimit = contextCharLimit;
    }

    public int getHistoryMessageLimit() {
        return historyMessageLimit;
    }

    public void setHistoryMessageLimit(int historyMessageLimit) {
        this.historyMessageLimit = historyMessageLimit;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public Endpoint getOpenai() {
        return openai;
    }

    /**
     * DeepSeek or any other endpoint speaking the OpenAI chat completion
     * protocol, bound from {@code rag.chat.openai.*}.
     */
    public static class Endpoint {

        /**
         * Sent as bearer token. When empty, {@code deepseek.api-key} is used.
         */
        private String apiKey;

        private String baseUrl = "https://api.deepseek.com";

        private String model = "deepseek-chat";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }
}
