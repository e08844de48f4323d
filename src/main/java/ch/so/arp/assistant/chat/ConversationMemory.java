package ch.so.arp.assistant.chat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short-term conversation history per community and user. Each conversation
 * keeps at most {@code maxRounds} question/answer pairs, and turns older than
 * the time to live are dropped before every read. Nothing is persisted, a
 * restart starts every conversation from scratch.
 *
 * <p>All mutations of a conversation run inside
 * {@link ConcurrentMap#compute(Object, java.util.function.BiFunction)} and are
 * therefore atomic per key without a global lock.
 */
public class ConversationMemory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationMemory.class);

    private final ConcurrentMap<ConversationKey, Deque<ConversationTurn>> conversations = new ConcurrentHashMap<>();
    private final Duration timeToLive;
    private final int maxMessages;
    private final Clock clock;

    public ConversationMemory(Duration timeToLive, int maxRounds, Clock clock) {
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("timeToLive must be positive");
        }
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive");
        }
        this.timeToLive = timeToLive;
        this.maxMessages = maxRounds * 2;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void appendTurn(String community, long userId, ChatRole role, String content) {
        ConversationTurn turn = new ConversationTurn(role, content, clock.instant());
        conversations.compute(new ConversationKey(community, userId), (key, turns) -> {
            Deque<ConversationTurn> target = turns == null ? new ArrayDeque<>() : turns;
            target.addLast(turn);
            while (target.size() > maxMessages) {
                target.pollFirst();
            }
            return target;
        });
    }

    /**
     * Return the live history of the conversation, oldest message first.
     */
    public List<ChatMessage> getHistory(String community, long userId) {
        Instant now = clock.instant();
        AtomicReference<List<ChatMessage>> history = new AtomicReference<>(List.of());
        conversations.computeIfPresent(new ConversationKey(community, userId), (key, turns) -> {
            prune(turns, now);
            history.set(turns.stream().map(ConversationTurn::toMessage).toList());
            return turns.isEmpty() ? null : turns;
        });
        return history.get();
    }

    public void clear(String community, long userId) {
        conversations.remove(new ConversationKey(community, userId));
    }

    /**
     * Drop conversations whose turns have all expired.
     *
     * @return the number of conversations removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger evicted = new AtomicInteger();
        for (ConversationKey key : conversations.keySet()) {
            conversations.computeIfPresent(key, (k, turns) -> {
                prune(turns, now);
                if (turns.isEmpty()) {
                    evicted.incrementAndGet();
                    return null;
                }
                return turns;
            });
        }
        if (evicted.get() > 0) {
            LOGGER.debug("Evicted {} expired conversations", evicted.get());
        }
        return evicted.get();
    }

    int conversationCount() {
        return conversations.size();
    }

    private void prune(Deque<ConversationTurn> turns, Instant now) {
        Instant cutoff = now.minus(timeToLive);
        turns.removeIf(turn -> !turn.createdAt().isAfter(cutoff));
        while (turns.size() > maxMessages) {
            turns.pollFirst();
        }
    }

    private record ConversationKey(String community, long userId) {
    }

    private record ConversationTurn(ChatRole role, String content, Instant createdAt) {

        ChatMessage toMessage() {
            return new ChatMessage(role, content);
        }
    }
}
