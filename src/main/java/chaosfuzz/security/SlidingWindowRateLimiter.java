package chaosfuzz.security;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window limiter over operation timestamps. A timestamp stays in the
 * window until it is strictly older than {@code window}; one exactly
 * {@code window} old still counts.
 *
 * <p>Not thread-safe: owned by the monitor thread.
 */
public final class SlidingWindowRateLimiter {

    private final Duration window;
    private final int maxOperations;
    private final Deque<Instant> timestamps = new ArrayDeque<>();

    public SlidingWindowRateLimiter(Duration window, int maxOperations) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Rate limit window must be positive.");
        }
        if (maxOperations <= 0) {
            throw new IllegalArgumentException("Max operations per window must be positive.");
        }
        this.window = window;
        this.maxOperations = maxOperations;
    }

    /** Records an operation at {@code now} if the window has room. */
    public boolean tryAcquire(Instant now) {
        prune(now);
        if (timestamps.size() >= maxOperations) {
            return false;
        }
        timestamps.addLast(now);
        return true;
    }

    public void acquire(Instant now) throws RateLimitExceededException {
        if (!tryAcquire(now)) {
            throw new RateLimitExceededException(maxOperations, window);
        }
    }

    public int operationsInWindow(Instant now) {
        prune(now);
        return timestamps.size();
    }

    public Duration window() {
        return window;
    }

    public int maxOperations() {
        return maxOperations;
    }

    private void prune(Instant now) {
        while (!timestamps.isEmpty()
                && Duration.between(timestamps.peekFirst(), now).compareTo(window) > 0) {
            timestamps.removeFirst();
        }
    }
}
