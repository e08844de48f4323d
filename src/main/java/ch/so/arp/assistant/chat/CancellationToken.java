package ch.so.arp.assistant.chat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller supplied signal that stops a model call. A token is cancelled either
 * explicitly through {@link #cancel()} or implicitly once its deadline passed.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Clock clock;
    private final Instant deadline;

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Token without deadline that is only cancelled explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        return new CancellationToken(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Wait up to {@code duration} for the token to be cancelled.
     *
     * @return {@code true} if the token is cancelled
     */
    public boolean awaitCancellation(Duration duration) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        Duration wait = duration;
        if (deadline != null) {
            Duration untilDeadline = Duration.between(clock.instant(), deadline);
            if (untilDeadline.compareTo(wait) < 0) {
                wait = untilDeadline;
            }
        }
        if (!wait.isNegative() && !wait.isZero()) {
            cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
        }
        return isCancelled();
    }
}
