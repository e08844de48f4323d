package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import ch.so.arp.assistant.MutableClock;

class ConversationMemoryTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
    private final ConversationMemory memory = new ConversationMemory(Duration.ofMinutes(30), 5, clock);

    @Test
    void keepsMostRecentRounds() {
        for (int round = 0; round < 20; round++) {
            memory.appendTurn("dev", 1L, ChatRole.USER, "question " + round);
            memory.appendTurn("dev", 1L, ChatRole.ASSISTANT, "answer " + round);
        }

        List<ChatMessage> history = memory.getHistory("dev", 1L);

        assertThat(history).hasSize(10);
        assertThat(history.get(0)).isEqualTo(ChatMessage.user("question 15"));
        assertThat(history.get(9)).isEqualTo(ChatMessage.assistant("answer 19"));
    }

    @Test
    void dropsExpiredTurns() {
        memory.appendTurn("dev", 1L, ChatRole.USER, "old question");
        clock.advance(Duration.ofMinutes(20));
        memory.appendTurn("dev", 1L, ChatRole.USER, "new question");
        clock.advance(Duration.ofMinutes(15));

        assertThat(memory.getHistory("dev", 1L)).containsExactly(ChatMessage.user("new question"));

        clock.advance(Duration.ofMinutes(30));
        assertThat(memory.getHistory("dev", 1L)).isEmpty();
        assertThat(memory.conversationCount()).isZero();
    }

    @Test
    void separatesUsersAndCommunities() {
        memory.appendTurn("dev", 1L, ChatRole.USER, "dev user 1");
        memory.appendTurn("dev", 2L, ChatRole.USER, "dev user 2");
        memory.appendTurn("ops", 1L, ChatRole.USER, "ops user 1");

        assertThat(memory.getHistory("dev", 1L)).containsExactly(ChatMessage.user("dev user 1"));
        assertThat(memory.getHistory("ops", 1L)).containsExactly(ChatMessage.user("ops user 1"));

        memory.clear("dev", 2L);
        assertThat(memory.getHistory("dev", 2L)).isEmpty();
    }

    @Test
    void evictsIdleConversations() {
        memory.appendTurn("dev", 1L, ChatRole.USER, "stale");
        clock.advance(Duration.ofMinutes(31));
        memory.appendTurn("dev", 2L, ChatRole.USER, "fresh");

        assertThat(memory.evictExpired()).isEqualTo(1);
        assertThat(memory.conversationCount()).isEqualTo(1);
    }

    @Test
    void appendsConcurrentlyWithoutLosingBound() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int message = i;
                futures.add(executor.submit(() -> {
                    memory.appendTurn("dev", 1L, ChatRole.USER, "message " + message);
                    memory.getHistory("dev", 1L);
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(memory.getHistory("dev", 1L)).hasSize(10);
    }
}
