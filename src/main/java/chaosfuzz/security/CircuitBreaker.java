package chaosfuzz.security;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global stop switch. Within an epoch the state only moves from
 * {@link CircuitBreakerState#CLOSED} to {@link CircuitBreakerState#OPEN};
 * {@link #reset()} is the only way back and starts a new epoch.
 */
public final class CircuitBreaker {

    private final long threshold;
    private final AtomicReference<CircuitBreakerState> state =
            new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final AtomicLong epoch = new AtomicLong();
    private final AtomicReference<String> tripReason = new AtomicReference<>();

    public CircuitBreaker(long threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Circuit breaker threshold must not be negative.");
        }
        this.threshold = threshold;
    }

    /**
     * Returns the reason the snapshot should trip the breaker, if any.
     *
     * @throws MonitorIntegrityException if aggregating the counters overflows
     */
    public Optional<String> evaluate(SecurityMetricsSnapshot metrics) {
        long totalManipulations = metrics.totalManipulations();
        long totalExploits = metrics.totalExploitAttempts();
        if (totalManipulations > threshold) {
            return Optional.of(String.format("Manipulation attempts %d exceed threshold %d",
                    totalManipulations, threshold));
        }
        if (totalExploits > threshold) {
            return Optional.of(String.format("Exploit attempts %d exceed threshold %d",
                    totalExploits, threshold));
        }
        if (metrics.failedTransactions() > metrics.totalTransactions() / 2) {
            return Optional.of(String.format("Failed transactions %d exceed half of %d",
                    metrics.failedTransactions(), metrics.totalTransactions()));
        }
        return Optional.empty();
    }

    /** @return true only for the call that actually opened the breaker */
    public boolean trip(String reason) {
        // Reason goes first so a reader that sees OPEN also sees why.
        tripReason.compareAndSet(null, reason);
        return state.compareAndSet(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
    }

    public void reset() {
        epoch.incrementAndGet();
        tripReason.set(null);
        state.set(CircuitBreakerState.CLOSED);
    }

    public CircuitBreakerState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == CircuitBreakerState.OPEN;
    }

    public Optional<String> tripReason() {
        return Optional.ofNullable(tripReason.get());
    }

    public long epoch() {
        return epoch.get();
    }

    public long threshold() {
        return threshold;
    }
}
