package ch.so.arp.assistant.chat;

import java.time.Duration;

/**
 * Delay to wait before a model call is retried.
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param failedAttempt number of the attempt that just failed, starting at 1
     */
    Duration delayAfter(int failedAttempt);

    static BackoffStrategy fixed(Duration delay) {
        return failedAttempt -> delay;
    }

    static BackoffStrategy none() {
        return failedAttempt -> Duration.ZERO;
    }
}
