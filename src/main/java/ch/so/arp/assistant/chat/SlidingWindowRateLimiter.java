package ch.so.arp.assistant.chat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-key rolling window limiter: a key is admitted while fewer than
 * {@code maxCalls} admissions happened during the last {@code window}. Rejected
 * calls are not recorded.
 */
public class SlidingWindowRateLimiter {

    private final ConcurrentMap<String, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final int maxCalls;
    private final Duration window;
    private final Clock clock;

    public SlidingWindowRateLimiter(int maxCalls, Duration window, Clock clock) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be positive");
        }
        this.maxCalls = maxCalls;
        this.window = Objects.requireNonNull(window, "window");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Return true and record the call if the key is within its limit. */
    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean();
        windows.compute(key, (k, calls) -> {
            Deque<Instant> active = calls == null ? new ArrayDeque<>() : calls;
            prune(active, now);
            if (active.size() < maxCalls) {
                active.addLast(now);
                admitted.set(true);
            }
            return active;
        });
        return admitted.get();
    }

    /** Drop keys without any call inside the window. */
    public void evictIdle() {
        Instant now = clock.instant();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, calls) -> {
                prune(calls, now);
                return calls.isEmpty() ? null : calls;
            });
        }
    }

    int trackedKeys() {
        return windows.size();
    }

    private void prune(Deque<Instant> calls, Instant now) {
        Instant cutoff = now.minus(window);
        while (!calls.isEmpty() && !calls.peekFirst().isAfter(cutoff)) {
            calls.pollFirst();
        }
    }
}
