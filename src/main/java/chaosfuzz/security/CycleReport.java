package chaosfuzz.security;

import java.time.Instant;

/** What one monitoring cycle did. {@code metrics} is null only for {@link Outcome#ALREADY_RUNNING}. */
public record CycleReport(Instant timestamp, Outcome outcome, SecurityMetricsSnapshot metrics,
                          CircuitBreakerState breakerState) {

    public enum Outcome {
        EVALUATED,
        /** Rate limiter rejected the cycle; the breaker was evaluated, the status report skipped. */
        RATE_LIMITED,
        /** Another cycle was still running. */
        ALREADY_RUNNING
    }
}
