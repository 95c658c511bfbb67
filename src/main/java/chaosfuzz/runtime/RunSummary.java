package chaosfuzz.runtime;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.TestResult;
import chaosfuzz.security.CircuitBreakerState;

/**
 * Result of one batch. Holds exactly one {@link TestResult} per submitted test
 * case, in submission order.
 *
 * @param haltReason why dispatch stopped early, or null if every test was dispatched
 */
public record RunSummary(
        List<TestResult> results,
        boolean circuitBreakerTripped,
        String haltReason,
        CircuitBreakerState breakerState,
        long peakInFlight) {

    public RunSummary {
        results = List.copyOf(results);
    }

    public long count(ExecutionStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public Map<ExecutionStatus, Long> countsByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        for (TestResult result : results) {
            counts.merge(result.status(), 1L, Long::sum);
        }
        return counts;
    }

    public boolean halted() {
        return haltReason != null;
    }

    public long findingCount() {
        return results.stream().mapToLong(r -> r.findings().size()).sum();
    }
}
