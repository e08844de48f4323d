package ch.so.arp.assistant.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import ch.so.arp.assistant.MutableClock;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
    private final SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(10, Duration.ofSeconds(60), clock);

    @Test
    void rejectsEleventhCallWithinWindow() {
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAcquire("dev")).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(limiter.tryAcquire("dev")).isFalse();
    }

    @Test
    void admitsAgainOnceWindowElapsed() {
        for (int i = 0; i < 10; i++) {
            limiter.tryAcquire("dev");
        }
        assertThat(limiter.tryAcquire("dev")).isFalse();

        clock.advance(Duration.ofSeconds(60));

        assertThat(limiter.tryAcquire("dev")).isTrue();
    }

    @Test
    void rejectedCallsDoNotExtendWindow() {
        for (int i = 0; i < 10; i++) {
            limiter.tryAcquire("dev");
        }
        clock.advance(Duration.ofSeconds(30));
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.tryAcquire("dev")).isFalse();
        }

        clock.advance(Duration.ofSeconds(30));

        assertThat(limiter.tryAcquire("dev")).isTrue();
    }

    @Test
    void limitsEachCommunitySeparately() {
        for (int i = 0; i < 10; i++) {
            limiter.tryAcquire("dev");
        }

        assertThat(limiter.tryAcquire("dev")).isFalse();
        assertThat(limiter.tryAcquire("ops")).isTrue();
    }

    @Test
    void evictsIdleKeys() {
        limiter.tryAcquire("dev");
        clock.advance(Duration.ofSeconds(61));
        limiter.tryAcquire("ops");

        limiter.evictIdle();

        assertThat(limiter.trackedKeys()).isEqualTo(1);
    }
}
