package ch.so.arp.assistant.chat;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@link LlmClient} for OpenAI compatible chat completion endpoints such as
 * DeepSeek. Requests are sent with a bearer credential through the JDK HTTP
 * client, so interrupting the calling thread aborts the exchange.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_ERROR_BODY_LENGTH = 200;

    private final RestClient restClient;

    OpenAiLlmClient(String baseUrl, String apiKey, RestClient.Builder builder, Duration timeout) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException(
                    "Property 'rag.chat.openai.api-key' or 'deepseek.api-key' must be provided when mocks are disabled");
        }
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);
        this.restClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .requestFactory(requestFactory)
                .build();
        LOGGER.info("Using chat completion endpoint {}", baseUrl);
    }

    @Override
    public LlmCompletion complete(LlmRequest request) throws LlmCallException, InterruptedException {
        CompletionResponse response;
        try {
            response = restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(CompletionResponse.class);
        } catch (RestClientResponseException ex) {
            throw new LlmCallException("Model endpoint answered " + ex.getStatusCode().value() + ": "
                    + abbreviate(ex.getResponseBodyAsString()), ex);
        } catch (RestClientException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Model call interrupted");
            }
            throw new LlmCallException("Model endpoint unreachable: " + ex.getMessage(), ex);
        }
        return toCompletion(response);
    }

    static LlmCompletion toCompletion(CompletionResponse response) throws LlmCallException {
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null
                || response.choices().get(0).message().content() == null) {
            throw new LlmCallException("Model endpoint returned no choices");
        }
        Usage usage = response.usage();
        TokenUsage tokenUsage = usage == null ? TokenUsage.NONE
                : new TokenUsage(valueOrZero(usage.promptTokens()), valueOrZero(usage.completionTokens()),
                        valueOrZero(usage.totalTokens()));
        return new LlmCompletion(response.choices().get(0).message().content(), tokenUsage);
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices, Usage usage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Usage(
            @JsonProperty("prompt_tokens") Integer promptTokens,
            @JsonProperty("completion_tokens") Integer completionTokens,
            @JsonProperty("total_tokens") Integer totalTokens) {
    }
}
