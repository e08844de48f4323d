package ch.so.arp.assistant.chat;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Global cap on concurrent outbound model calls. Callers beyond the limit wait
 * for a free slot in arrival order until their token is cancelled.
 */
public class ConcurrencyGate {

    private static final long POLL_MILLIS = 50L;

    private final Semaphore permits;
    private final int capacity;

    public ConcurrencyGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Take a slot, waiting while the gate is full.
     *
     * @return {@code false} if the token was cancelled before a slot was free
     */
    public boolean acquire(CancellationToken token) throws InterruptedException {
        while (!token.isCancelled()) {
            if (permits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    public void release() {
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int availableSlots() {
        return permits.availablePermits();
    }
}
