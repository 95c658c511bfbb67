package chaosfuzz.security;

import java.util.Map;

public record SecurityMetricsSnapshot(
        long voteManipulations,
        long executionManipulations,
        long stateManipulations,
        Map<String, Long> exploitAttempts,
        long failedTransactions,
        long totalTransactions) {

    public SecurityMetricsSnapshot {
        exploitAttempts = Map.copyOf(exploitAttempts);
    }

    public static SecurityMetricsSnapshot empty() {
        return new SecurityMetricsSnapshot(0L, 0L, 0L, Map.of(), 0L, 0L);
    }

    /**
     * @throws MonitorIntegrityException if the sum overflows
     */
    public long totalManipulations() {
        try {
            return Math.addExact(Math.addExact(voteManipulations, executionManipulations), stateManipulations);
        } catch (ArithmeticException overflow) {
            throw new MonitorIntegrityException("Manipulation total overflowed", overflow);
        }
    }

    /**
     * @throws MonitorIntegrityException if the sum overflows
     */
    public long totalExploitAttempts() {
        long total = 0L;
        try {
            for (long count : exploitAttempts.values()) {
                total = Math.addExact(total, count);
            }
        } catch (ArithmeticException overflow) {
            throw new MonitorIntegrityException("Exploit attempt total overflowed", overflow);
        }
        return total;
    }
}
