package chaosfuzz.runtime;

import java.time.Instant;
import java.util.List;

import chaosfuzz.model.TestResult;
import chaosfuzz.runtime.monitoring.GlobalStats;
import chaosfuzz.security.CircuitBreakerState;
import chaosfuzz.security.SecurityMetricsSnapshot;

/** JSON document written at the end of a run. */
public record SessionReport(
        String programId,
        long sessionSeed,
        Instant startedAt,
        Instant finishedAt,
        long elapsedMillis,
        boolean circuitBreakerTripped,
        String haltReason,
        CircuitBreakerState breakerState,
        long monitoringEpoch,
        GlobalStats.FinalMetrics metrics,
        SecurityMetricsSnapshot securityMetrics,
        List<TestResult> results) {
}
