package ch.so.arp.assistant.chat;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Keeps asynchronous chat requests open for as long as an answer may take. The
 * container timeout is derived from {@code rag.chat.answer-timeout} so that a
 * slow model still ends in a regular answer instead of a servlet timeout.
 */
@Configuration(proxyBeanMethods = false)
public class ChatWebConfiguration implements WebMvcConfigurer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatWebConfiguration.class);

    /**
     * Time granted after the answer deadline to record usage and write the response.
     */
    static final Duration RESPONSE_GRACE = Duration.ofSeconds(10);

    private final ChatProperties chatProperties;

    public ChatWebConfiguration(ChatProperties chatProperties) {
        this.chatProperties = chatProperties;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        Duration timeout = asyncRequestTimeout();
        LOGGER.debug("Async request timeout set to {}", timeout);
        configurer.setDefaultTimeout(timeout.toMillis());
    }

    Duration asyncRequestTimeout() {
        return chatProperties.getAnswerTimeout().plus(RESPONSE_GRACE);
    }
}
