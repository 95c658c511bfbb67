package chaosfuzz.runtime.monitoring;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

import chaosfuzz.model.ExecutionStatus;
import chaosfuzz.model.TestResult;
import chaosfuzz.mutators.MutatorType;
import chaosfuzz.runtime.scheduling.MutatorScheduler.MutationAttemptStatus;

/**
 * Run-wide counters shared by all workers. Every method is safe to call from
 * any thread without external locking.
 */
public final class GlobalStats {
    private final LongAdder totalTestsDispatched = new LongAdder();
    private final LongAdder totalTestsExecuted = new LongAdder();
    private final LongAdder[] statusCounts;
    private final LongAdder findings = new LongAdder();
    private final LongAdder accumulatedExecMillis = new LongAdder();
    private final LongAdder accumulatedComputeUnits = new LongAdder();
    private final LongAccumulator peakInFlight = new LongAccumulator(Math::max, 0L);

    private final LongAdder[] mutatorMutationSuccessCounts;
    private final LongAdder[] mutatorMutationSkipCounts;
    private final LongAdder[] mutatorMutationFailureCounts;

    public GlobalStats() {
        ExecutionStatus[] statuses = ExecutionStatus.values();
        this.statusCounts = new LongAdder[statuses.length];
        for (int i = 0; i < statuses.length; i++) {
            statusCounts[i] = new LongAdder();
        }
        MutatorType[] mutatorTypes = MutatorType.values();
        this.mutatorMutationSuccessCounts = new LongAdder[mutatorTypes.length];
        this.mutatorMutationSkipCounts = new LongAdder[mutatorTypes.length];
        this.mutatorMutationFailureCounts = new LongAdder[mutatorTypes.length];
        for (int i = 0; i < mutatorTypes.length; i++) {
            mutatorMutationSuccessCounts[i] = new LongAdder();
            mutatorMutationSkipCounts[i] = new LongAdder();
            mutatorMutationFailureCounts[i] = new LongAdder();
        }
    }

    /** Record that a test was taken from the queue and handed to a worker. */
    public void recordTestDispatched() {
        totalTestsDispatched.increment();
    }

    /** Call this once per test when its result is final. */
    public void recordResult(TestResult result) {
        statusCounts[result.status().ordinal()].increment();
        findings.add(result.findings().size());
        if (result.status().invokedTarget()) {
            totalTestsExecuted.increment();
            accumulatedExecMillis.add(result.metrics().executionTimeMillis());
            accumulatedComputeUnits.add(result.metrics().computeUnits());
        }
    }

    public void recordInFlight(long currentlyHeld) {
        peakInFlight.accumulate(currentlyHeld);
    }

    public void recordMutationAttempt(MutatorType type, MutationAttemptStatus status) {
        if (type == null || status == null) {
            return;
        }
        int idx = type.ordinal();
        switch (status) {
            case SUCCESS -> mutatorMutationSuccessCounts[idx].increment();
            case NOT_APPLICABLE -> mutatorMutationSkipCounts[idx].increment();
            case FAILED -> mutatorMutationFailureCounts[idx].increment();
        }
    }

    public long getTotalTestsDispatched() {
        return totalTestsDispatched.sum();
    }

    public long getTotalTestsExecuted() {
        return totalTestsExecuted.sum();
    }

    public long getStatusCount(ExecutionStatus status) {
        return statusCounts[status.ordinal()].sum();
    }

    public long getFindings() {
        return findings.sum();
    }

    public long getPeakInFlight() {
        return peakInFlight.get();
    }

    public double getAvgExecTimeMillis() {
        long n = totalTestsExecuted.sum();
        return (n == 0) ? 0.0 : accumulatedExecMillis.sum() / (double) n;
    }

    public double getAvgComputeUnits() {
        long n = totalTestsExecuted.sum();
        return (n == 0) ? 0.0 : accumulatedComputeUnits.sum() / (double) n;
    }

    public long getMutatorSuccessCount(MutatorType type) {
        return mutatorMutationSuccessCounts[type.ordinal()].sum();
    }

    public long getMutatorSkipCount(MutatorType type) {
        return mutatorMutationSkipCounts[type.ordinal()].sum();
    }

    public long getMutatorFailureCount(MutatorType type) {
        return mutatorMutationFailureCounts[type.ordinal()].sum();
    }

    public FinalMetrics snapshotFinalMetrics() {
        Map<ExecutionStatus, Long> byStatus = new EnumMap<>(ExecutionStatus.class);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            byStatus.put(status, getStatusCount(status));
        }
        Map<MutatorType, Long> mutatorSuccesses = new EnumMap<>(MutatorType.class);
        for (MutatorType type : MutatorType.values()) {
            mutatorSuccesses.put(type, getMutatorSuccessCount(type));
        }
        return new FinalMetrics(
                getTotalTestsDispatched(),
                getTotalTestsExecuted(),
                byStatus,
                getFindings(),
                getPeakInFlight(),
                getAvgExecTimeMillis(),
                getAvgComputeUnits(),
                mutatorSuccesses);
    }

    public record FinalMetrics(
            long totalDispatched,
            long totalExecuted,
            Map<ExecutionStatus, Long> byStatus,
            long findings,
            long peakInFlight,
            double avgExecTimeMillis,
            double avgComputeUnits,
            Map<MutatorType, Long> mutatorSuccesses) {

        public FinalMetrics {
            byStatus = Map.copyOf(byStatus);
            mutatorSuccesses = Map.copyOf(mutatorSuccesses);
        }

        public long count(ExecutionStatus status) {
            return byStatus.getOrDefault(status, 0L);
        }
    }
}
