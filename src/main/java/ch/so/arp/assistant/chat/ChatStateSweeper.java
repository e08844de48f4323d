package ch.so.arp.assistant.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically drops expired conversations and idle rate windows so that the
 * in-memory state does not grow with every community ever seen.
 */
public class ChatStateSweeper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatStateSweeper.class);

    private final ConversationMemory conversationMemory;
    private final SlidingWindowRateLimiter rateLimiter;

    public ChatStateSweeper(ConversationMemory conversationMemory, SlidingWindowRateLimiter rateLimiter) {
        this.conversationMemory = conversationMemory;
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${rag.chat.sweep-interval:PT1M}", initialDelayString = "${rag.chat.sweep-interval:PT1M}")
    public void sweep() {
        int evicted = conversationMemory.evictExpired();
        rateLimiter.evictIdle();
        LOGGER.trace("Sweep finished, {} conversations evicted", evicted);
    }
}
