package chaosfuzz.security;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import chaosfuzz.model.ManipulationType;

/**
 * Failure and exploit signals for the current monitoring epoch. Workers record
 * into it concurrently; the monitor thread reads snapshots.
 *
 * <p>All additions are checked: an overflow raises {@link MonitorIntegrityException}
 * instead of wrapping.
 */
public final class SecurityMetrics {

    private final Map<ManipulationType, AtomicLong> manipulations = new EnumMap<>(ManipulationType.class);
    private final ConcurrentHashMap<String, AtomicLong> exploitAttempts = new ConcurrentHashMap<>();
    private final AtomicLong failedTransactions = new AtomicLong();
    private final AtomicLong totalTransactions = new AtomicLong();

    public SecurityMetrics() {
        for (ManipulationType type : ManipulationType.values()) {
            manipulations.put(type, new AtomicLong());
        }
    }

    public void recordTransaction(boolean success) {
        checkedAdd(totalTransactions, 1L, "total transactions");
        if (!success) {
            checkedAdd(failedTransactions, 1L, "failed transactions");
        }
    }

    public void recordManipulationAttempt(ManipulationType type, long count) {
        checkedAdd(manipulations.get(type), count, type.name().toLowerCase() + " manipulations");
    }

    public void recordExploitAttempt(String category, long count) {
        AtomicLong counter = exploitAttempts.computeIfAbsent(category, key -> new AtomicLong());
        checkedAdd(counter, count, "exploit attempts for " + category);
    }

    public SecurityMetricsSnapshot snapshot() {
        Map<String, Long> exploits = new LinkedHashMap<>();
        exploitAttempts.forEach((category, count) -> exploits.put(category, count.get()));
        return new SecurityMetricsSnapshot(
                manipulations.get(ManipulationType.VOTE).get(),
                manipulations.get(ManipulationType.EXECUTION).get(),
                manipulations.get(ManipulationType.STATE).get(),
                exploits,
                failedTransactions.get(),
                totalTransactions.get());
    }

    /** Clears every counter; used when a new monitoring epoch starts. */
    public void reset() {
        manipulations.values().forEach(counter -> counter.set(0L));
        exploitAttempts.clear();
        failedTransactions.set(0L);
        totalTransactions.set(0L);
    }

    private static void checkedAdd(AtomicLong counter, long delta, String name) {
        if (delta < 0) {
            throw new IllegalArgumentException("Counter increments must not be negative: " + delta);
        }
        try {
            counter.updateAndGet(value -> Math.addExact(value, delta));
        } catch (ArithmeticException overflow) {
            throw new MonitorIntegrityException("Counter overflow: " + name, overflow);
        }
    }
}
